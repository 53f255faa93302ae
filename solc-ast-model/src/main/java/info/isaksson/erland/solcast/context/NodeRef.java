package info.isaksson.erland.solcast.context;

import info.isaksson.erland.solcast.node.AstNode;

import java.util.Optional;

/**
 * Non-owning reference to another node, by identity.
 *
 * <p>The target is looked up in the {@link AstContext} on every access, so references survive
 * node replacement. A reference is <em>external</em> when its identity names something outside
 * the read (negative identities of built-ins such as {@code msg}, declarations from sources that
 * were not part of the compiler output); external references resolve to "unknown".</p>
 */
public final class NodeRef {

    private final AstContext context;
    private final long id;
    private boolean external;

    NodeRef(AstContext context, long id) {
        this.context = context;
        this.id = id;
    }

    /** Reference to an already registered node. */
    public static NodeRef to(AstNode target) {
        if (target == null) throw new IllegalArgumentException("target must not be null");
        if (target.getContext() == null) {
            throw new IllegalArgumentException("Node " + target + " is not registered in a context");
        }
        return target.getContext().reference(target.getId());
    }

    public long getId() {
        return id;
    }

    public AstContext getContext() {
        return context;
    }

    public boolean isExternal() {
        return external;
    }

    public void markExternal() {
        this.external = true;
    }

    /** True if the reference currently points at a registered node. */
    public boolean isResolved() {
        return !external && context.contains(id);
    }

    /**
     * The referenced node; empty for external references and for targets removed from the tree.
     *
     * @throws info.isaksson.erland.solcast.error.UnresolvedReferenceException if the identity was
     *         never registered and the reference was not marked external
     */
    public Optional<AstNode> target() {
        if (external || context.wasRemoved(id)) return Optional.empty();
        return Optional.of(context.resolve(id));
    }

    public <T extends AstNode> Optional<T> target(Class<T> type) {
        return target().filter(type::isInstance).map(type::cast);
    }

    @Override public String toString() {
        return "ref#" + id + (external ? "(external)" : "");
    }
}
