package info.isaksson.erland.solcast.node.type;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;

public final class Mapping extends TypeName {

    private final Slot<TypeName> keyType = requiredSlot(TypeName.class);
    private String keyName;
    private final Slot<TypeName> valueType = requiredSlot(TypeName.class);
    private String valueName;

    public Mapping(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MAPPING;
    }

    public TypeName getKeyType() {
        return keyType.get();
    }

    public void setKeyType(TypeName keyType) {
        this.keyType.set(keyType);
    }

    /** Key name (0.8.18+), or {@code null}. */
    public String getKeyName() {
        return keyName;
    }

    public void setKeyName(String keyName) {
        this.keyName = keyName;
    }

    public TypeName getValueType() {
        return valueType.get();
    }

    public void setValueType(TypeName valueType) {
        this.valueType.set(valueType);
    }

    public String getValueName() {
        return valueName;
    }

    public void setValueName(String valueName) {
        this.valueName = valueName;
    }
}
