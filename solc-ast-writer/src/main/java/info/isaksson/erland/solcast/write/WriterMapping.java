package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable table of rendering rules, one per node kind. Start from {@link #standard()} and
 * override any subset of kinds with {@link #withRule(NodeKind, NodeRenderer)}.
 */
public final class WriterMapping {

    private static final WriterMapping STANDARD = new WriterMapping(standardRules());

    private final Map<NodeKind, NodeRenderer<?>> rules;

    private WriterMapping(Map<NodeKind, NodeRenderer<?>> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    /** The rules that render every node kind as compiler-accepted source. */
    public static WriterMapping standard() {
        return STANDARD;
    }

    /** Copy of this mapping with the rule for {@code kind} replaced. */
    public <N extends AstNode> WriterMapping withRule(NodeKind kind, NodeRenderer<N> renderer) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (renderer == null) throw new IllegalArgumentException("renderer must not be null");
        Map<NodeKind, NodeRenderer<?>> copy = new EnumMap<>(NodeKind.class);
        copy.putAll(rules);
        copy.put(kind, renderer);
        return new WriterMapping(copy);
    }

    public boolean hasRule(NodeKind kind) {
        return rules.containsKey(kind);
    }

    @SuppressWarnings("unchecked")
    String render(AstNode node, RenderContext context) {
        NodeRenderer<AstNode> rule = (NodeRenderer<AstNode>) rules.get(node.getKind());
        if (rule == null) {
            throw new IllegalStateException("No rendering rule for " + node.getKind().rawName());
        }
        return rule.render(node, context);
    }

    private static Map<NodeKind, NodeRenderer<?>> standardRules() {
        Map<NodeKind, NodeRenderer<?>> m = new EnumMap<>(NodeKind.class);
        MetaRules.register(m);
        DeclarationRules.register(m);
        StatementRules.register(m);
        ExpressionRules.register(m);
        TypeNameRules.register(m);
        return m;
    }
}
