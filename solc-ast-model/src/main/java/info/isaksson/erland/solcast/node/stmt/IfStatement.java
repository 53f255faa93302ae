package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

public final class IfStatement extends Statement {

    private final Slot<Expression> condition = requiredSlot(Expression.class);
    private final Slot<Statement> trueBody = requiredSlot(Statement.class);
    private final Slot<Statement> falseBody = slot(Statement.class);

    public IfStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF_STATEMENT;
    }

    public Expression getCondition() {
        return condition.get();
    }

    public void setCondition(Expression condition) {
        this.condition.set(condition);
    }

    public Statement getTrueBody() {
        return trueBody.get();
    }

    public void setTrueBody(Statement trueBody) {
        this.trueBody.set(trueBody);
    }

    public Statement getFalseBody() {
        return falseBody.get();
    }

    public void setFalseBody(Statement falseBody) {
        this.falseBody.set(falseBody);
    }
}
