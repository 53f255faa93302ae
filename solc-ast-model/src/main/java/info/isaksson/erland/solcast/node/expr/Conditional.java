package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

public final class Conditional extends Expression {

    private final Slot<Expression> condition = requiredSlot(Expression.class);
    private final Slot<Expression> trueExpression = requiredSlot(Expression.class);
    private final Slot<Expression> falseExpression = requiredSlot(Expression.class);

    public Conditional(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONDITIONAL;
    }

    public Expression getCondition() {
        return condition.get();
    }

    public void setCondition(Expression condition) {
        this.condition.set(condition);
    }

    public Expression getTrueExpression() {
        return trueExpression.get();
    }

    public void setTrueExpression(Expression trueExpression) {
        this.trueExpression.set(trueExpression);
    }

    public Expression getFalseExpression() {
        return falseExpression.get();
    }

    public void setFalseExpression(Expression falseExpression) {
        this.falseExpression.set(falseExpression);
    }
}
