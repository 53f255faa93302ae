package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.meta.OverrideSpecifier;
import info.isaksson.erland.solcast.node.stmt.Block;

public final class ModifierDefinition extends CallableDeclaration {

    private final Slot<OverrideSpecifier> overrides = slot(OverrideSpecifier.class);
    private final Slot<Block> body = slot(Block.class);

    public ModifierDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODIFIER_DEFINITION;
    }

    public OverrideSpecifier getOverrides() {
        return overrides.get();
    }

    public void setOverrides(OverrideSpecifier overrides) {
        this.overrides.set(overrides);
    }

    public Block getBody() {
        return body.get();
    }

    public void setBody(Block body) {
        this.body.set(body);
    }
}
