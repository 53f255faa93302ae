package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.FunctionCallKind;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.List;

/**
 * Function call, type conversion or struct constructor call. {@code names} is non-empty for
 * calls with named arguments ({@code f({a: 1, b: 2})}) and then runs parallel to the arguments.
 */
public final class FunctionCall extends Expression {

    private final Slot<Expression> expression = requiredSlot(Expression.class);
    private final NodeList<Expression> arguments = list(Expression.class);
    private List<String> names = List.of();
    private FunctionCallKind callKind;
    private Boolean typeConversionFlag;
    private Boolean structConstructorCallFlag;
    private boolean tryCall;

    public FunctionCall(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_CALL;
    }

    public Expression getExpression() {
        return expression.get();
    }

    public void setExpression(Expression expression) {
        this.expression.set(expression);
    }

    public NodeList<Expression> getArguments() {
        return arguments;
    }

    public List<String> getNames() {
        return names;
    }

    public void setNames(List<String> names) {
        this.names = names == null ? List.of() : List.copyOf(names);
    }

    public FunctionCallKind getCallKind() {
        return callKind;
    }

    public void setCallKind(FunctionCallKind callKind) {
        this.callKind = callKind;
    }

    public Boolean getTypeConversionFlag() {
        return typeConversionFlag;
    }

    public void setTypeConversionFlag(Boolean typeConversionFlag) {
        this.typeConversionFlag = typeConversionFlag;
    }

    public Boolean getStructConstructorCallFlag() {
        return structConstructorCallFlag;
    }

    public void setStructConstructorCallFlag(Boolean structConstructorCallFlag) {
        this.structConstructorCallFlag = structConstructorCallFlag;
    }

    public boolean isTryCall() {
        return tryCall;
    }

    public void setTryCall(boolean tryCall) {
        this.tryCall = tryCall;
    }
}
