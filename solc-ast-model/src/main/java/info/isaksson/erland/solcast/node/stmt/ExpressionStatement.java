package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

public final class ExpressionStatement extends Statement {

    private final Slot<Expression> expression = requiredSlot(Expression.class);

    public ExpressionStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }

    public Expression getExpression() {
        return expression.get();
    }

    public void setExpression(Expression expression) {
        this.expression.set(expression);
    }
}
