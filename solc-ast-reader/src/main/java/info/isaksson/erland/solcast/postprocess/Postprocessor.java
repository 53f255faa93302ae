package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.List;

/**
 * One normalization pass over freshly read trees.
 *
 * <p>Passes must be idempotent and must not remove nodes; running a pass twice leaves the trees
 * as after the first run.</p>
 */
public interface Postprocessor {

    String name();

    /**
     * @param version compiler version of the output, or {@code null} when unknown
     */
    void apply(List<SourceUnit> units, AstContext context, SolcVersion version);
}
