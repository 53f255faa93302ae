package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

/** Custom error, 0.8.4+. */
public final class ErrorDefinition extends CallableDeclaration {

    public ErrorDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ERROR_DEFINITION;
    }
}
