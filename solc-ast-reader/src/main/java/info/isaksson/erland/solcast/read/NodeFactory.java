package info.isaksson.erland.solcast.read;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.SourceRange;

/** Node constructor, typically a {@code Kind::new} reference. */
@FunctionalInterface
public interface NodeFactory<T extends AstNode> {
    T create(long id, SourceRange source);
}
