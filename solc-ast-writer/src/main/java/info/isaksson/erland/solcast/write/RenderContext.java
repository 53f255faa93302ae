package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.error.UnsupportedForTargetVersionException;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * State threaded through one {@link SourceWriter} call: the rule mapping, the target version,
 * the format policy and the indentation depth. Nothing else is carried between rules, so
 * rendering the same tree twice yields the same text.
 */
public final class RenderContext {

    private static final Logger log = LoggerFactory.getLogger(RenderContext.class);

    private final WriterMapping mapping;
    private final SolcVersion targetVersion;
    private final FormatPolicy policy;
    private int depth;

    RenderContext(WriterMapping mapping, SolcVersion targetVersion, FormatPolicy policy) {
        this.mapping = mapping;
        this.targetVersion = targetVersion;
        this.policy = policy;
    }

    public SolcVersion getTargetVersion() {
        return targetVersion;
    }

    public FormatPolicy getPolicy() {
        return policy;
    }

    public int depth() {
        return depth;
    }

    /** Renders a node at the current depth with the rule the mapping selects for its kind. */
    public String render(AstNode node) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        return mapping.render(node, this);
    }

    /** Renders a node one level deeper, e.g. a statement inside a block. */
    public String renderNested(AstNode node) {
        return nested(() -> render(node));
    }

    public <T> T nested(Supplier<T> body) {
        depth++;
        try {
            return body.get();
        } finally {
            depth--;
        }
    }

    /** Leading whitespace of the current depth. */
    public String indent() {
        return policy.indent(depth);
    }

    /** Leading whitespace of a line {@code extra} levels below the current depth. */
    public String indent(int extra) {
        return policy.indent(depth + extra);
    }

    /** Separator between consecutive members of a contract or source unit. */
    public String memberSeparator() {
        return policy.compact ? "\n" : "\n\n";
    }

    public boolean supports(VersionGate gate) {
        return gate.allows(targetVersion);
    }

    /**
     * Checks a gate that has no older spelling.
     *
     * @throws UnsupportedForTargetVersionException if the target version is outside the gate
     */
    public void require(VersionGate gate, AstNode node) {
        if (!gate.allows(targetVersion)) {
            throw new UnsupportedForTargetVersionException(gate.feature, targetVersion, gate.requirement(),
                    node.getKind().rawName(), pathOf(node));
        }
    }

    /** Records that a rule chose an older spelling for the node. */
    public void fellBack(VersionGate gate, AstNode node) {
        if (log.isDebugEnabled()) {
            log.debug("{} not available for solc {}; using older spelling for {}", gate.feature, targetVersion, node);
        }
    }

    /** Path of the node from its tree root, e.g. {@code /SourceUnit#9/ContractDefinition#8}. */
    public static String pathOf(AstNode node) {
        Deque<AstNode> chain = new ArrayDeque<>();
        for (AstNode n = node; n != null; n = n.getParent().orElse(null)) chain.push(n);
        StringBuilder sb = new StringBuilder();
        for (AstNode n : chain) sb.append('/').append(n);
        return sb.toString();
    }
}
