package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.type.TypeName;

/** {@code type Price is uint128;} 0.8.8+. */
public final class UserDefinedValueTypeDefinition extends Declaration {

    private String canonicalName;
    private final Slot<TypeName> underlyingType = requiredSlot(TypeName.class);

    public UserDefinedValueTypeDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USER_DEFINED_VALUE_TYPE_DEFINITION;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public void setCanonicalName(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public TypeName getUnderlyingType() {
        return underlyingType.get();
    }

    public void setUnderlyingType(TypeName underlyingType) {
        this.underlyingType.set(underlyingType);
    }
}
