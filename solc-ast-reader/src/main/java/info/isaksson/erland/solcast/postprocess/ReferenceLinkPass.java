package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Marks references external when their identity cannot be resolved in this read: negative
 * identities (solc's built-in declarations such as {@code msg} or {@code require}) and identities
 * of declarations that are not part of the compiler output.
 */
public final class ReferenceLinkPass implements Postprocessor {

    private static final Logger log = LoggerFactory.getLogger(ReferenceLinkPass.class);

    @Override
    public String name() {
        return "reference-link";
    }

    @Override
    public void apply(List<SourceUnit> units, AstContext context, SolcVersion version) {
        int external = 0;
        for (NodeRef ref : context.references()) {
            if (ref.isExternal()) continue;
            if (ref.getId() < 0 || (!context.contains(ref.getId()) && !context.wasRemoved(ref.getId()))) {
                ref.markExternal();
                external++;
            }
        }
        if (external > 0) log.debug("Marked {} reference(s) external", external);
    }
}
