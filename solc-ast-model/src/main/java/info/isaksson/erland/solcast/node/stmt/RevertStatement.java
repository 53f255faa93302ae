package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.FunctionCall;

/** {@code revert CustomError(...)}, 0.8.4+. */
public final class RevertStatement extends Statement {

    private final Slot<FunctionCall> errorCall = requiredSlot(FunctionCall.class);

    public RevertStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.REVERT_STATEMENT;
    }

    public FunctionCall getErrorCall() {
        return errorCall.get();
    }

    public void setErrorCall(FunctionCall errorCall) {
        this.errorCall.set(errorCall);
    }
}
