package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.List;

/** {@code f{value: 1, gas: 2}}, 0.6.2+. {@code names} runs parallel to the options. */
public final class FunctionCallOptions extends Expression {

    private final Slot<Expression> expression = requiredSlot(Expression.class);
    private List<String> names = List.of();
    private final NodeList<Expression> options = list(Expression.class);

    public FunctionCallOptions(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_CALL_OPTIONS;
    }

    public Expression getExpression() {
        return expression.get();
    }

    public void setExpression(Expression expression) {
        this.expression.set(expression);
    }

    public List<String> getNames() {
        return names;
    }

    public void setNames(List<String> names) {
        this.names = names == null ? List.of() : List.copyOf(names);
    }

    public NodeList<Expression> getOptions() {
        return options;
    }
}
