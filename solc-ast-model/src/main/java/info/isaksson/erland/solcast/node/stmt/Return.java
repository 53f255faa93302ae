package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

public final class Return extends Statement {

    private final Slot<Expression> expression = slot(Expression.class);
    private NodeRef functionReturnParameters;

    public Return(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RETURN;
    }

    public Expression getExpression() {
        return expression.get();
    }

    public void setExpression(Expression expression) {
        this.expression.set(expression);
    }

    public NodeRef getFunctionReturnParameters() {
        return functionReturnParameters;
    }

    public void setFunctionReturnParameters(NodeRef functionReturnParameters) {
        this.functionReturnParameters = functionReturnParameters;
    }
}
