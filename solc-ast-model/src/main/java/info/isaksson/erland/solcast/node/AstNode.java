package info.isaksson.erland.solcast.node;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.print.NodePrinters;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Base of every node variant.
 *
 * <p>Nodes form a strict forest: each node has at most one parent, and child fields are declared
 * by subclasses through {@link #slot(Class)} and {@link #list(Class)} in source order, which fixes
 * the order of {@link #getChildren()}. Non-owning relations to other nodes are expressed as
 * {@link info.isaksson.erland.solcast.context.NodeRef}s resolved through the {@link AstContext}.</p>
 *
 * <p>Not thread-safe; a tree and its context must be confined to one thread at a time.</p>
 */
public abstract class AstNode {

    private final long id;
    private SourceRange source;
    private AstNode parent;
    private AstContext context;
    private final List<ChildHolder> holders = new ArrayList<>();
    private final Map<String, JsonNode> extras = new TreeMap<>();

    protected AstNode(long id, SourceRange source) {
        this.id = id;
        this.source = source;
    }

    public abstract NodeKind getKind();

    public final long getId() {
        return id;
    }

    /** Source range, or {@code null} for synthetic nodes. */
    public final SourceRange getSource() {
        return source;
    }

    public final void setSource(SourceRange source) {
        this.source = source;
    }

    /** Empty only for roots (source units and detached nodes). */
    public final Optional<AstNode> getParent() {
        return Optional.ofNullable(parent);
    }

    /** The context this node is registered in, or {@code null} for free-standing nodes. */
    public final AstContext getContext() {
        return context;
    }

    /**
     * Binds this node to the context that just registered it. Called by
     * {@link AstContext#register(AstNode)}; rejects contexts that do not hold this node.
     */
    public final void bindContext(AstContext ctx) {
        if (ctx != null && ctx.lookup(id).orElse(null) != this) {
            throw new IllegalStateException("Node #" + id + " is not registered in the given context");
        }
        this.context = ctx;
    }

    /** Ordered children, skipping empty optional fields. */
    public final List<AstNode> getChildren() {
        List<AstNode> out = new ArrayList<>();
        for (ChildHolder h : holders) h.collect(out);
        return Collections.unmodifiableList(out);
    }

    /** All descendants (pre-order, excluding this node) matching the predicate. */
    public final List<AstNode> descendants(Predicate<? super AstNode> predicate) {
        List<AstNode> out = new ArrayList<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        pushChildrenReversed(this, stack);
        while (!stack.isEmpty()) {
            AstNode n = stack.pop();
            if (predicate.test(n)) out.add(n);
            pushChildrenReversed(n, stack);
        }
        return out;
    }

    public final <T extends AstNode> List<T> descendants(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (AstNode n : descendants(type::isInstance)) out.add(type.cast(n));
        return out;
    }

    public final Optional<AstNode> nearestAncestor(Predicate<? super AstNode> predicate) {
        for (AstNode p = parent; p != null; p = p.parent) {
            if (predicate.test(p)) return Optional.of(p);
        }
        return Optional.empty();
    }

    public final <T extends AstNode> Optional<T> nearestAncestor(Class<T> type) {
        return nearestAncestor(type::isInstance).map(type::cast);
    }

    /** Root of the tree this node belongs to (itself for roots). */
    public final AstNode getRoot() {
        AstNode n = this;
        while (n.parent != null) n = n.parent;
        return n;
    }

    /**
     * Detaches this node and its whole subtree from its parent. References elsewhere that point
     * into the removed subtree resolve to "unknown" afterwards.
     *
     * @throws IllegalStateException if this node fills a required field of its parent
     */
    public final void remove() {
        if (parent == null) return;
        for (ChildHolder h : parent.holders) {
            if (h.remove(this)) return;
        }
        throw new IllegalStateException("Node #" + id + " not found among the children of its parent #" + parent.id);
    }

    /** Raw fields the reader did not model, kept for round-tripping. */
    public final Map<String, JsonNode> getExtras() {
        return extras;
    }

    /** Renders this node with the default writer settings. */
    public final String print() {
        return NodePrinters.defaultPrinter().print(this);
    }

    protected final <T extends AstNode> Slot<T> slot(Class<T> type) {
        Slot<T> s = new Slot<>(this, type, false);
        holders.add(s);
        return s;
    }

    protected final <T extends AstNode> Slot<T> requiredSlot(Class<T> type) {
        Slot<T> s = new Slot<>(this, type, true);
        holders.add(s);
        return s;
    }

    protected final <T extends AstNode> NodeList<T> list(Class<T> type) {
        NodeList<T> l = new NodeList<>(this, type, false);
        holders.add(l);
        return l;
    }

    protected final <T extends AstNode> NodeList<T> listWithEmptySlots(Class<T> type) {
        NodeList<T> l = new NodeList<>(this, type, true);
        holders.add(l);
        return l;
    }

    /** Validates an adoption that replaces {@code replaced}; nothing is changed when this throws. */
    final void checkAdoptable(AstNode child, AstNode replaced) {
        if (child.parent != null) {
            throw new IllegalStateException("Node #" + child.id + " (" + child.getKind().rawName()
                    + ") already has parent #" + child.parent.id + "; remove it first");
        }
        for (AstNode p = this; p != null; p = p.parent) {
            if (p == child) {
                throw new IllegalStateException("Node #" + child.id + " cannot become its own descendant");
            }
        }
        if (context != null) context.checkAttachable(child, replaced);
    }

    final void adopt(AstNode child) {
        child.parent = this;
        if (context != null) context.attached(child);
    }

    final void release(AstNode child) {
        child.parent = null;
        if (child.context != null) child.context.detached(child);
    }

    private static void pushChildrenReversed(AstNode n, Deque<AstNode> stack) {
        List<AstNode> kids = n.getChildren();
        for (int i = kids.size() - 1; i >= 0; i--) stack.push(kids.get(i));
    }

    @Override public String toString() {
        return getKind().rawName() + "#" + id;
    }
}
