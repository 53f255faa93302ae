package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

public final class Break extends Statement {

    public Break(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BREAK;
    }
}
