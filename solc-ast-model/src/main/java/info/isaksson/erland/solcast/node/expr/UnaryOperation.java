package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

public final class UnaryOperation extends Expression {

    private String operator;
    private boolean prefix;
    private final Slot<Expression> subExpression = requiredSlot(Expression.class);

    public UnaryOperation(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY_OPERATION;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        Operators.requireUnary(operator);
        this.operator = operator;
    }

    public boolean isPrefix() {
        return prefix;
    }

    public void setPrefix(boolean prefix) {
        this.prefix = prefix;
    }

    public Expression getSubExpression() {
        return subExpression.get();
    }

    public void setSubExpression(Expression subExpression) {
        this.subExpression.set(subExpression);
    }
}
