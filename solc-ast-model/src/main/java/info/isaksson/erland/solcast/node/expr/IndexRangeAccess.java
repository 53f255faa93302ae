package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

/** Calldata slice {@code x[start:end]}, 0.6.0+. */
public final class IndexRangeAccess extends Expression {

    private final Slot<Expression> baseExpression = requiredSlot(Expression.class);
    private final Slot<Expression> startExpression = slot(Expression.class);
    private final Slot<Expression> endExpression = slot(Expression.class);

    public IndexRangeAccess(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INDEX_RANGE_ACCESS;
    }

    public Expression getBaseExpression() {
        return baseExpression.get();
    }

    public void setBaseExpression(Expression baseExpression) {
        this.baseExpression.set(baseExpression);
    }

    public Expression getStartExpression() {
        return startExpression.get();
    }

    public void setStartExpression(Expression startExpression) {
        this.startExpression.set(startExpression);
    }

    public Expression getEndExpression() {
        return endExpression.get();
    }

    public void setEndExpression(Expression endExpression) {
        this.endExpression.set(endExpression);
    }
}
