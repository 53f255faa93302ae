package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

public final class DoWhileStatement extends Statement {

    private final Slot<Statement> body = requiredSlot(Statement.class);
    private final Slot<Expression> condition = requiredSlot(Expression.class);

    public DoWhileStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DO_WHILE_STATEMENT;
    }

    public Statement getBody() {
        return body.get();
    }

    public void setBody(Statement body) {
        this.body.set(body);
    }

    public Expression getCondition() {
        return condition.get();
    }

    public void setCondition(Expression condition) {
        this.condition.set(condition);
    }
}
