package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;

/**
 * Renders (possibly mutated) trees back to Solidity source.
 *
 * <p>Output is a pure function of node, target version, policy and mapping: calling a write
 * method twice with the same arguments yields byte-identical text. Constructs that cannot be
 * spelled for the target version fail the whole call with
 * {@link info.isaksson.erland.solcast.error.UnsupportedForTargetVersionException}; no partial
 * text is returned.</p>
 */
public final class SourceWriter {

    private SourceWriter() {}

    public static String write(AstNode node, SolcVersion targetVersion) {
        return write(node, targetVersion, FormatPolicy.defaults(), WriterMapping.standard());
    }

    public static String write(AstNode node, SolcVersion targetVersion, FormatPolicy policy) {
        return write(node, targetVersion, policy, WriterMapping.standard());
    }

    public static String write(AstNode node, SolcVersion targetVersion, FormatPolicy policy, WriterMapping mapping) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        if (targetVersion == null) throw new IllegalArgumentException("targetVersion must not be null");
        if (policy == null) policy = FormatPolicy.defaults();
        if (mapping == null) mapping = WriterMapping.standard();

        String text = new RenderContext(mapping, targetVersion, policy).render(node);
        if (node instanceof SourceUnit && policy.finalNewline && !text.endsWith("\n")) {
            text = text + "\n";
        }
        return text;
    }
}
