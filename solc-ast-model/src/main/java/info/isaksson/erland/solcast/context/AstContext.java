package info.isaksson.erland.solcast.context;

import info.isaksson.erland.solcast.error.DuplicateIdentityException;
import info.isaksson.erland.solcast.error.UnresolvedReferenceException;
import info.isaksson.erland.solcast.node.AstNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Identity registry for the nodes produced by one read.
 *
 * <p>Identities are only unique within one compiler invocation, so a context is never shared or
 * merged across reads. The context also tracks every {@link NodeRef} it hands out and the
 * declaration-to-usage index built during postprocessing.</p>
 */
public final class AstContext {

    private final Map<Long, AstNode> nodes = new LinkedHashMap<>();
    private final Set<Long> removed = new HashSet<>();
    private final List<NodeRef> references = new ArrayList<>();
    private final Map<Long, List<AstNode>> usages = new HashMap<>();
    private boolean registrationClosed;
    private long maxId;

    /**
     * Inserts a node under its identity.
     *
     * @throws DuplicateIdentityException if the identity is already taken
     */
    public void register(AstNode node) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        long id = node.getId();
        AstNode existing = nodes.get(id);
        if (existing != null) {
            throw new DuplicateIdentityException(id, node.getKind().rawName(), existing.getKind().rawName());
        }
        nodes.put(id, node);
        removed.remove(id);
        if (id > maxId) maxId = id;
        node.bindContext(this);
    }

    /**
     * Node registered under the identity.
     *
     * @throws UnresolvedReferenceException if nothing is registered under it
     */
    public AstNode resolve(long id) {
        AstNode n = nodes.get(id);
        if (n == null) {
            throw new UnresolvedReferenceException(id, registrationClosed
                    ? (removed.contains(id) ? "the node was removed" : "registration is closed")
                    : "registration is still open");
        }
        return n;
    }

    public <T extends AstNode> T resolve(long id, Class<T> type) {
        AstNode n = resolve(id);
        if (!type.isInstance(n)) {
            throw new UnresolvedReferenceException(id, "expected " + type.getSimpleName()
                    + " but found " + n.getKind().rawName());
        }
        return type.cast(n);
    }

    public Optional<AstNode> lookup(long id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(long id) {
        return nodes.containsKey(id);
    }

    /** True if a node was registered under the identity and later removed from its tree. */
    public boolean wasRemoved(long id) {
        return removed.contains(id);
    }

    /** Ends the registration phase of a read; reference resolution may start afterwards. */
    public void closeRegistration() {
        registrationClosed = true;
    }

    public boolean isRegistrationClosed() {
        return registrationClosed;
    }

    /** Creates and tracks a reference to the given identity. */
    public NodeRef reference(long id) {
        NodeRef ref = new NodeRef(this, id);
        references.add(ref);
        return ref;
    }

    public List<NodeRef> references() {
        return Collections.unmodifiableList(references);
    }

    /** A fresh identity above every identity registered so far, for caller-created nodes. */
    public long newSyntheticId() {
        return ++maxId;
    }

    public int size() {
        return nodes.size();
    }

    public Collection<AstNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Nodes whose resolved reference points at the declaration, in tree order. */
    public List<AstNode> usagesOf(AstNode declaration) {
        List<AstNode> u = usages.get(declaration.getId());
        return u == null ? List.of() : Collections.unmodifiableList(u);
    }

    /** Replaces the declaration-to-usage index. */
    public void replaceUsages(Map<Long, List<AstNode>> index) {
        usages.clear();
        for (Map.Entry<Long, List<AstNode>> e : index.entrySet()) {
            usages.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
    }

    /**
     * Verifies that {@link #attached(AstNode)} would succeed for the subtree without changing
     * anything. Identities held by the subtree of {@code replaced}, which is about to be detached,
     * count as free.
     *
     * @throws DuplicateIdentityException if an identity of the subtree is already taken
     */
    public void checkAttachable(AstNode root, AstNode replaced) {
        if (nodes.get(root.getId()) == root) return;
        Set<AstNode> leaving = replaced == null ? Set.of() : new HashSet<>(subtree(replaced));
        Map<Long, AstNode> seen = new HashMap<>();
        for (AstNode n : subtree(root)) {
            AstNode existing = nodes.get(n.getId());
            if (existing == n) continue;
            if (existing == null || leaving.contains(existing)) existing = seen.get(n.getId());
            if (existing != null) {
                throw new DuplicateIdentityException(n.getId(), n.getKind().rawName(), existing.getKind().rawName());
            }
            seen.put(n.getId(), n);
        }
    }

    /** Called when a subtree is adopted by a node of this context; registers it if needed. */
    public void attached(AstNode root) {
        if (nodes.get(root.getId()) == root) return;
        for (AstNode n : subtree(root)) {
            if (nodes.get(n.getId()) != n) register(n);
        }
    }

    /** Called when a subtree is detached from its parent; its identities stop resolving. */
    public void detached(AstNode root) {
        for (AstNode n : subtree(root)) {
            if (nodes.get(n.getId()) == n) {
                nodes.remove(n.getId());
                removed.add(n.getId());
                usages.remove(n.getId());
            }
        }
        for (List<AstNode> users : usages.values()) {
            users.removeIf(u -> removed.contains(u.getId()));
        }
    }

    private static List<AstNode> subtree(AstNode root) {
        List<AstNode> out = new ArrayList<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode n = stack.pop();
            out.add(n);
            for (AstNode c : n.getChildren()) stack.push(c);
        }
        return out;
    }
}
