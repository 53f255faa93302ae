package info.isaksson.erland.solcast.print;

import java.util.Iterator;
import java.util.ServiceLoader;

/** Locates the {@link NodePrinter} used by {@code AstNode.print()}. */
public final class NodePrinters {

    private static volatile NodePrinter cached;

    private NodePrinters() {}

    public static NodePrinter defaultPrinter() {
        NodePrinter p = cached;
        if (p != null) return p;
        Iterator<NodePrinter> it = ServiceLoader.load(NodePrinter.class).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No NodePrinter found on the classpath; add solc-ast-writer");
        }
        p = it.next();
        cached = p;
        return p;
    }
}
