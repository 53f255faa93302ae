package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

/** A modifier or base constructor call on a function header. */
public final class ModifierInvocation extends AstNode {

    private final Slot<AstNode> modifierName = requiredSlot(AstNode.class);
    private final NodeList<Expression> arguments = list(Expression.class);
    private boolean argumentsPresent;
    private String invocationKind;

    public ModifierInvocation(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODIFIER_INVOCATION;
    }

    /** An {@link Identifier} (before 0.8) or an {@link IdentifierPath}. */
    public AstNode getModifierName() {
        return modifierName.get();
    }

    public void setModifierName(AstNode modifierName) {
        this.modifierName.set(modifierName);
    }

    public NodeList<Expression> getArguments() {
        return arguments;
    }

    public boolean isArgumentsPresent() {
        return argumentsPresent;
    }

    public void setArgumentsPresent(boolean argumentsPresent) {
        this.argumentsPresent = argumentsPresent;
    }

    /** {@code modifierInvocation} or {@code baseConstructorSpecifier} (0.8.3+), else {@code null}. */
    public String getInvocationKind() {
        return invocationKind;
    }

    public void setInvocationKind(String invocationKind) {
        this.invocationKind = invocationKind;
    }
}
