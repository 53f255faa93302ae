package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;

/** {@code override} or {@code override(A, B)}. */
public final class OverrideSpecifier extends AstNode {

    private final NodeList<AstNode> overrides = list(AstNode.class);

    public OverrideSpecifier(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OVERRIDE_SPECIFIER;
    }

    public NodeList<AstNode> getOverrides() {
        return overrides;
    }
}
