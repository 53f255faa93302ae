package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.expr.Expression;

/**
 * Local variable declaration. Tuple declarations may leave slots empty
 * ({@code (, uint b) = f();}); such slots are {@code null} entries of {@link #getDeclarations()}.
 */
public final class VariableDeclarationStatement extends Statement {

    private final NodeList<VariableDeclaration> declarations = listWithEmptySlots(VariableDeclaration.class);
    private final Slot<Expression> initialValue = slot(Expression.class);

    public VariableDeclarationStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE_DECLARATION_STATEMENT;
    }

    public NodeList<VariableDeclaration> getDeclarations() {
        return declarations;
    }

    public Expression getInitialValue() {
        return initialValue.get();
    }

    public void setInitialValue(Expression initialValue) {
        this.initialValue.set(initialValue);
    }
}
