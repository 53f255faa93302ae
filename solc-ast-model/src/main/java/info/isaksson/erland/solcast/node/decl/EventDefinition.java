package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

public final class EventDefinition extends CallableDeclaration {

    private boolean anonymous;

    public EventDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EVENT_DEFINITION;
    }

    public boolean isAnonymous() {
        return anonymous;
    }

    public void setAnonymous(boolean anonymous) {
        this.anonymous = anonymous;
    }
}
