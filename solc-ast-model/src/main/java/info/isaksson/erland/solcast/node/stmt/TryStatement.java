package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;
import info.isaksson.erland.solcast.node.meta.TryCatchClause;

/** {@code try} statement, 0.6.0+. The first clause is the success clause. */
public final class TryStatement extends Statement {

    private final Slot<Expression> externalCall = requiredSlot(Expression.class);
    private final NodeList<TryCatchClause> clauses = list(TryCatchClause.class);

    public TryStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRY_STATEMENT;
    }

    public Expression getExternalCall() {
        return externalCall.get();
    }

    public void setExternalCall(Expression externalCall) {
        this.externalCall.set(externalCall);
    }

    public NodeList<TryCatchClause> getClauses() {
        return clauses;
    }
}
