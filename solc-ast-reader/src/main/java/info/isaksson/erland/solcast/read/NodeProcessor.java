package info.isaksson.erland.solcast.read;

import info.isaksson.erland.solcast.node.AstNode;

/**
 * Maps one raw node kind onto the model.
 *
 * <p>Implementations create their node through {@link ProcessingSession#open}, which registers it
 * before any child is built, then read fields and build children through the session.</p>
 */
@FunctionalInterface
public interface NodeProcessor<R extends RawNode> {
    AstNode process(R raw, ProcessingSession<R> session);
}
