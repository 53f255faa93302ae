package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;

public final class EnumDefinition extends Declaration {

    private String canonicalName;
    private final NodeList<EnumValue> members = list(EnumValue.class);

    public EnumDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ENUM_DEFINITION;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public void setCanonicalName(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public NodeList<EnumValue> getMembers() {
        return members;
    }
}
