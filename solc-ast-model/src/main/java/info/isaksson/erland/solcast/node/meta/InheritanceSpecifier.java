package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

/** Base contract in a contract header, with optional constructor arguments. */
public final class InheritanceSpecifier extends AstNode {

    private final Slot<AstNode> baseName = requiredSlot(AstNode.class);
    private final NodeList<Expression> arguments = list(Expression.class);
    private boolean argumentsPresent;

    public InheritanceSpecifier(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INHERITANCE_SPECIFIER;
    }

    /** A {@link UserDefinedTypeName} (before 0.8) or an {@link IdentifierPath}. */
    public AstNode getBaseName() {
        return baseName.get();
    }

    public void setBaseName(AstNode baseName) {
        this.baseName.set(baseName);
    }

    public NodeList<Expression> getArguments() {
        return arguments;
    }

    /** Distinguishes {@code B()} from {@code B}. */
    public boolean isArgumentsPresent() {
        return argumentsPresent;
    }

    public void setArgumentsPresent(boolean argumentsPresent) {
        this.argumentsPresent = argumentsPresent;
    }
}
