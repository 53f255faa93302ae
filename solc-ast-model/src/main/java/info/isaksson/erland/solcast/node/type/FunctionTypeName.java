package info.isaksson.erland.solcast.node.type;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.meta.ParameterList;

public final class FunctionTypeName extends TypeName {

    private Visibility visibility;
    private StateMutability stateMutability;
    private Boolean constantFlag;
    private Boolean payableFlag;
    private final Slot<ParameterList> parameterTypes = requiredSlot(ParameterList.class);
    private final Slot<ParameterList> returnParameterTypes = requiredSlot(ParameterList.class);

    public FunctionTypeName(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_TYPE_NAME;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }

    public StateMutability getStateMutability() {
        return stateMutability;
    }

    public void setStateMutability(StateMutability stateMutability) {
        this.stateMutability = stateMutability;
    }

    public Boolean getConstantFlag() {
        return constantFlag;
    }

    public void setConstantFlag(Boolean constantFlag) {
        this.constantFlag = constantFlag;
    }

    public Boolean getPayableFlag() {
        return payableFlag;
    }

    public void setPayableFlag(Boolean payableFlag) {
        this.payableFlag = payableFlag;
    }

    public ParameterList getParameterTypes() {
        return parameterTypes.get();
    }

    public void setParameterTypes(ParameterList parameterTypes) {
        this.parameterTypes.set(parameterTypes);
    }

    public ParameterList getReturnParameterTypes() {
        return returnParameterTypes.get();
    }

    public void setReturnParameterTypes(ParameterList returnParameterTypes) {
        this.returnParameterTypes.set(returnParameterTypes);
    }
}
