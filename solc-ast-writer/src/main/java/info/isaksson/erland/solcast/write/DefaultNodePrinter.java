package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.print.NodePrinter;
import info.isaksson.erland.solcast.version.SolcVersion;

/**
 * Backs {@link AstNode#print()}: standard mapping, default format policy, latest supported
 * compiler version. Registered through {@code META-INF/services}.
 */
public final class DefaultNodePrinter implements NodePrinter {

    @Override
    public String print(AstNode node) {
        return SourceWriter.write(node, SolcVersion.LATEST, FormatPolicy.defaults(), WriterMapping.standard());
    }
}
