package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.FunctionCall;

public final class EmitStatement extends Statement {

    private final Slot<FunctionCall> eventCall = requiredSlot(FunctionCall.class);

    public EmitStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EMIT_STATEMENT;
    }

    public FunctionCall getEventCall() {
        return eventCall.get();
    }

    public void setEventCall(FunctionCall eventCall) {
        this.eventCall.set(eventCall);
    }
}
