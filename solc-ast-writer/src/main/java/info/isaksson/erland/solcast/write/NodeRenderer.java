package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;

/**
 * Rendering rule for one node kind. Rules render children through
 * {@link RenderContext#render(AstNode)} so that overrides apply at every depth.
 */
@FunctionalInterface
public interface NodeRenderer<N extends AstNode> {

    /**
     * Source text of the node. Multi-line results start without indentation and indent their
     * continuation lines at {@link RenderContext#depth()}.
     */
    String render(N node, RenderContext context);
}
