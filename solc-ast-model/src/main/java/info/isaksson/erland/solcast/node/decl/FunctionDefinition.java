package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.FunctionKind;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.StateMutability;
import info.isaksson.erland.solcast.node.meta.ModifierInvocation;
import info.isaksson.erland.solcast.node.meta.OverrideSpecifier;
import info.isaksson.erland.solcast.node.meta.ParameterList;
import info.isaksson.erland.solcast.node.stmt.Block;

import java.util.List;

/**
 * Function, constructor, fallback or receive function.
 *
 * <p>{@code kind} and {@code stateMutability} are absent in pre-0.5 output and are synthesized by
 * postprocessing from the legacy flags kept here ({@code constructorFlag}, {@code constantFlag},
 * {@code payableFlag}).</p>
 */
public final class FunctionDefinition extends CallableDeclaration {

    private FunctionKind functionKind;
    private StateMutability stateMutability;
    private Boolean constructorFlag;
    private Boolean constantFlag;
    private Boolean payableFlag;
    private Boolean implemented;
    private String functionSelector;
    private List<NodeRef> baseFunctions = List.of();
    private final Slot<OverrideSpecifier> overrides = slot(OverrideSpecifier.class);
    private final NodeList<ModifierInvocation> modifiers = list(ModifierInvocation.class);
    private final Slot<ParameterList> returnParameters = slot(ParameterList.class);
    private final Slot<Block> body = slot(Block.class);

    public FunctionDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_DEFINITION;
    }

    public FunctionKind getFunctionKind() {
        return functionKind;
    }

    public void setFunctionKind(FunctionKind functionKind) {
        this.functionKind = functionKind;
    }

    public StateMutability getStateMutability() {
        return stateMutability;
    }

    public void setStateMutability(StateMutability stateMutability) {
        this.stateMutability = stateMutability;
    }

    public Boolean getConstructorFlag() {
        return constructorFlag;
    }

    public void setConstructorFlag(Boolean constructorFlag) {
        this.constructorFlag = constructorFlag;
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

    public Boolean getImplemented() {
        return implemented;
    }

    public void setImplemented(Boolean implemented) {
        this.implemented = implemented;
    }

    public String getFunctionSelector() {
        return functionSelector;
    }

    public void setFunctionSelector(String functionSelector) {
        this.functionSelector = functionSelector;
    }

    public List<NodeRef> getBaseFunctions() {
        return baseFunctions;
    }

    public void setBaseFunctions(List<NodeRef> baseFunctions) {
        this.baseFunctions = baseFunctions == null ? List.of() : List.copyOf(baseFunctions);
    }

    public OverrideSpecifier getOverrides() {
        return overrides.get();
    }

    public void setOverrides(OverrideSpecifier overrides) {
        this.overrides.set(overrides);
    }

    public NodeList<ModifierInvocation> getModifiers() {
        return modifiers;
    }

    public ParameterList getReturnParameters() {
        return returnParameters.get();
    }

    public void setReturnParameters(ParameterList returnParameters) {
        this.returnParameters.set(returnParameters);
    }

    /** Function body; {@code null} for unimplemented functions. */
    public Block getBody() {
        return body.get();
    }

    public void setBody(Block body) {
        this.body.set(body);
    }
}
