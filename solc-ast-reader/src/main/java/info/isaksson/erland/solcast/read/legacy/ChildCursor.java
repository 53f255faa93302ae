package info.isaksson.erland.solcast.read.legacy;

import info.isaksson.erland.solcast.node.NodeCategory;
import info.isaksson.erland.solcast.node.NodeKind;

import java.util.ArrayList;
import java.util.List;

/** Positional reader over the children of a legacy node. */
final class ChildCursor {

    private final LegacyRawNode owner;
    private final List<LegacyRawNode> children;
    private int pos;

    ChildCursor(LegacyRawNode owner) {
        this.owner = owner;
        this.children = owner.children();
    }

    boolean hasNext() {
        return pos < children.size();
    }

    LegacyRawNode peek() {
        return hasNext() ? children.get(pos) : null;
    }

    int remaining() {
        return children.size() - pos;
    }

    /** Next child; fails when the children are exhausted. */
    LegacyRawNode next(String field) {
        if (!hasNext()) throw owner.shapeError("missing child for '" + field + "'");
        return children.get(pos++);
    }

    /** Next child if it has the kind, otherwise {@code null} without advancing. */
    LegacyRawNode nextIf(NodeKind kind) {
        LegacyRawNode n = peek();
        if (n != null && n.is(kind)) {
            pos++;
            return n;
        }
        return null;
    }

    LegacyRawNode nextIf(NodeCategory category) {
        LegacyRawNode n = peek();
        if (n != null && n.category() == category) {
            pos++;
            return n;
        }
        return null;
    }

    /**
     * Optional child following the null-attribute convention: an explicit {@code null} attribute
     * of that name means the child is absent; otherwise the next child is taken, if any.
     */
    LegacyRawNode optional(String attribute) {
        if (owner.isExplicitNull(attribute)) {
            owner.ignore(attribute);
            return null;
        }
        owner.ignore(attribute);
        return hasNext() ? children.get(pos++) : null;
    }

    List<LegacyRawNode> rest() {
        List<LegacyRawNode> out = new ArrayList<>(children.subList(pos, children.size()));
        pos = children.size();
        return out;
    }

    void expectEnd() {
        if (hasNext()) {
            throw owner.shapeError("unexpected extra child " + children.get(pos).kind() + " at position " + pos);
        }
    }
}
