package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.types.TypeDescriptions;

public final class BinaryOperation extends Expression {

    private String operator;
    private final Slot<Expression> leftExpression = requiredSlot(Expression.class);
    private final Slot<Expression> rightExpression = requiredSlot(Expression.class);
    private TypeDescriptions commonType;

    public BinaryOperation(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY_OPERATION;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        Operators.requireBinary(operator);
        this.operator = operator;
    }

    public Expression getLeftExpression() {
        return leftExpression.get();
    }

    public void setLeftExpression(Expression leftExpression) {
        this.leftExpression.set(leftExpression);
    }

    public Expression getRightExpression() {
        return rightExpression.get();
    }

    public void setRightExpression(Expression rightExpression) {
        this.rightExpression.set(rightExpression);
    }

    public TypeDescriptions getCommonType() {
        return commonType;
    }

    public void setCommonType(TypeDescriptions commonType) {
        this.commonType = commonType;
    }
}
