package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

public final class WhileStatement extends Statement {

    private final Slot<Expression> condition = requiredSlot(Expression.class);
    private final Slot<Statement> body = requiredSlot(Statement.class);

    public WhileStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.WHILE_STATEMENT;
    }

    public Expression getCondition() {
        return condition.get();
    }

    public void setCondition(Expression condition) {
        this.condition.set(condition);
    }

    public Statement getBody() {
        return body.get();
    }

    public void setBody(Statement body) {
        this.body.set(body);
    }
}
