package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

public final class EnumValue extends Declaration {

    public EnumValue(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ENUM_VALUE;
    }
}
