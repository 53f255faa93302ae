package info.isaksson.erland.solcast.node;

import java.util.List;

/** One ordered child field of a node: a {@link Slot} or a {@link NodeList}. */
interface ChildHolder {

    void collect(List<AstNode> out);

    /** Removes the child if this holder owns it. */
    boolean remove(AstNode child);
}
