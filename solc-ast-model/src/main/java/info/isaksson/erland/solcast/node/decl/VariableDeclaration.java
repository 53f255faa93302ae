package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.Mutability;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.StorageLocation;
import info.isaksson.erland.solcast.node.Visibility;
import info.isaksson.erland.solcast.node.expr.Expression;
import info.isaksson.erland.solcast.node.meta.OverrideSpecifier;
import info.isaksson.erland.solcast.node.type.TypeName;
import info.isaksson.erland.solcast.types.TypeDescriptions;

import java.util.List;

/**
 * State variable, local variable, parameter, return variable, struct member or event
 * parameter. A {@code null} type name denotes a pre-0.5 {@code var} declaration.
 */
public final class VariableDeclaration extends Declaration {

    private final Slot<TypeName> typeName = slot(TypeName.class);
    private final Slot<OverrideSpecifier> overrides = slot(OverrideSpecifier.class);
    private final Slot<Expression> value = slot(Expression.class);
    private TypeDescriptions typeDescriptions;
    private boolean constantFlag;
    private Mutability mutability;
    private boolean stateVariable;
    private StorageLocation storageLocation = StorageLocation.DEFAULT;
    private Visibility visibility;
    private boolean indexed;
    private String functionSelector;
    private List<NodeRef> baseFunctions = List.of();

    public VariableDeclaration(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE_DECLARATION;
    }

    public TypeName getTypeName() {
        return typeName.get();
    }

    public void setTypeName(TypeName typeName) {
        this.typeName.set(typeName);
    }

    public OverrideSpecifier getOverrides() {
        return overrides.get();
    }

    public void setOverrides(OverrideSpecifier overrides) {
        this.overrides.set(overrides);
    }

    public Expression getValue() {
        return value.get();
    }

    public void setValue(Expression value) {
        this.value.set(value);
    }

    public TypeDescriptions getTypeDescriptions() {
        return typeDescriptions;
    }

    public void setTypeDescriptions(TypeDescriptions typeDescriptions) {
        this.typeDescriptions = typeDescriptions;
    }

    public boolean isConstantFlag() {
        return constantFlag;
    }

    public void setConstantFlag(boolean constantFlag) {
        this.constantFlag = constantFlag;
    }

    public Mutability getMutability() {
        return mutability;
    }

    public void setMutability(Mutability mutability) {
        this.mutability = mutability;
    }

    public boolean isStateVariable() {
        return stateVariable;
    }

    public void setStateVariable(boolean stateVariable) {
        this.stateVariable = stateVariable;
    }

    public StorageLocation getStorageLocation() {
        return storageLocation;
    }

    public void setStorageLocation(StorageLocation storageLocation) {
        this.storageLocation = storageLocation;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public void setIndexed(boolean indexed) {
        this.indexed = indexed;
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
}
