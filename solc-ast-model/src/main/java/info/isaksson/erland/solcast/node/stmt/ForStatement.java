package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

/** {@code for (init; condition; loop) body}; every header part is optional. */
public final class ForStatement extends Statement {

    private final Slot<Statement> initializationExpression = slot(Statement.class);
    private final Slot<Expression> condition = slot(Expression.class);
    private final Slot<ExpressionStatement> loopExpression = slot(ExpressionStatement.class);
    private final Slot<Statement> body = requiredSlot(Statement.class);

    public ForStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOR_STATEMENT;
    }

    public Statement getInitializationExpression() {
        return initializationExpression.get();
    }

    public void setInitializationExpression(Statement initializationExpression) {
        this.initializationExpression.set(initializationExpression);
    }

    public Expression getCondition() {
        return condition.get();
    }

    public void setCondition(Expression condition) {
        this.condition.set(condition);
    }

    public ExpressionStatement getLoopExpression() {
        return loopExpression.get();
    }

    public void setLoopExpression(ExpressionStatement loopExpression) {
        this.loopExpression.set(loopExpression);
    }

    public Statement getBody() {
        return body.get();
    }

    public void setBody(Statement body) {
        this.body.set(body);
    }
}
