package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;

/**
 * Parenthesised expression, tuple or inline array ({@code [a, b]}). Empty tuple slots are
 * {@code null} entries of {@link #getComponents()}.
 */
public final class TupleExpression extends Expression {

    private boolean inlineArray;
    private final NodeList<Expression> components = listWithEmptySlots(Expression.class);

    public TupleExpression(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TUPLE_EXPRESSION;
    }

    public boolean isInlineArray() {
        return inlineArray;
    }

    public void setInlineArray(boolean inlineArray) {
        this.inlineArray = inlineArray;
    }

    public NodeList<Expression> getComponents() {
        return components;
    }
}
