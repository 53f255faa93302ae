package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

public final class Assignment extends Expression {

    private String operator;
    private final Slot<Expression> leftHandSide = requiredSlot(Expression.class);
    private final Slot<Expression> rightHandSide = requiredSlot(Expression.class);

    public Assignment(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGNMENT;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        Operators.requireAssignment(operator);
        this.operator = operator;
    }

    public Expression getLeftHandSide() {
        return leftHandSide.get();
    }

    public void setLeftHandSide(Expression leftHandSide) {
        this.leftHandSide.set(leftHandSide);
    }

    public Expression getRightHandSide() {
        return rightHandSide.get();
    }

    public void setRightHandSide(Expression rightHandSide) {
        this.rightHandSide.set(rightHandSide);
    }
}
