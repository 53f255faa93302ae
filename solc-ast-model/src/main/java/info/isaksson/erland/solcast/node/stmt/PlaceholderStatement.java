package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

/** The {@code _;} of a modifier body. */
public final class PlaceholderStatement extends Statement {

    public PlaceholderStatement(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PLACEHOLDER_STATEMENT;
    }
}
