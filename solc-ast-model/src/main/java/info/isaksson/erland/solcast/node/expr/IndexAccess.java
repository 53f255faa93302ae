package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

public final class IndexAccess extends Expression {

    private final Slot<Expression> baseExpression = requiredSlot(Expression.class);
    private final Slot<Expression> indexExpression = slot(Expression.class);

    public IndexAccess(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INDEX_ACCESS;
    }

    public Expression getBaseExpression() {
        return baseExpression.get();
    }

    public void setBaseExpression(Expression baseExpression) {
        this.baseExpression.set(baseExpression);
    }

    public Expression getIndexExpression() {
        return indexExpression.get();
    }

    public void setIndexExpression(Expression indexExpression) {
        this.indexExpression.set(indexExpression);
    }
}
