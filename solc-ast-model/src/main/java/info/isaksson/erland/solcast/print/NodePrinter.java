package info.isaksson.erland.solcast.print;

import info.isaksson.erland.solcast.node.AstNode;

/**
 * Service interface behind {@link AstNode#print()}. Implementations are discovered with
 * {@link java.util.ServiceLoader}; the writer module registers the default one.
 */
public interface NodePrinter {

    String print(AstNode node);
}
