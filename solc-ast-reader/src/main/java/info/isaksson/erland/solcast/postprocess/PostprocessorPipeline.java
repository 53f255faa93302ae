package info.isaksson.erland.solcast.postprocess;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Ordered list of postprocessing passes. */
public final class PostprocessorPipeline {

    private static final Logger log = LoggerFactory.getLogger(PostprocessorPipeline.class);

    private final List<Postprocessor> passes;

    private PostprocessorPipeline(List<Postprocessor> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * The standard order. Reference linking comes first so that later passes can rely on
     * {@code NodeRef.target()} not throwing; usage indexing comes last so it sees final links.
     * <ol>
     *   <li>{@link ReferenceLinkPass}</li>
     *   <li>{@link ScopeRepairPass}</li>
     *   <li>{@link FunctionKindPass}</li>
     *   <li>{@link MutabilityPass}</li>
     *   <li>{@link TypeNameHarmonizationPass}</li>
     *   <li>{@link DocumentationPass}</li>
     *   <li>{@link UsageIndexPass}</li>
     * </ol>
     */
    public static PostprocessorPipeline standard() {
        return new PostprocessorPipeline(List.of(
                new ReferenceLinkPass(),
                new ScopeRepairPass(),
                new FunctionKindPass(),
                new MutabilityPass(),
                new TypeNameHarmonizationPass(),
                new DocumentationPass(),
                new UsageIndexPass()));
    }

    public static PostprocessorPipeline of(Postprocessor... passes) {
        return new PostprocessorPipeline(Arrays.asList(passes));
    }

    public static PostprocessorPipeline none() {
        return new PostprocessorPipeline(List.of());
    }

    /** This pipeline followed by an extra pass. */
    public PostprocessorPipeline then(Postprocessor pass) {
        if (pass == null) throw new IllegalArgumentException("pass must not be null");
        List<Postprocessor> next = new ArrayList<>(passes);
        next.add(pass);
        return new PostprocessorPipeline(next);
    }

    public List<Postprocessor> passes() {
        return passes;
    }

    public void run(List<SourceUnit> units, AstContext context, SolcVersion version) {
        for (Postprocessor p : passes) {
            log.debug("Running postprocessor {}", p.name());
            p.apply(units, context, version);
        }
    }
}
