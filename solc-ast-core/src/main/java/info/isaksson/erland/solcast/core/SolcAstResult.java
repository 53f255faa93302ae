package info.isaksson.erland.solcast.core;

import info.isaksson.erland.solcast.read.ReadResult;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Regeneration result container for programmatic usage. */
public final class SolcAstResult {
    /**
     * Regenerated source text keyed by the unit's absolute path, in source id order.
     * Units without a path are keyed {@code #<id>}.
     */
    public final Map<String, String> sources;

    /** The trees the text was written from. */
    public final ReadResult readResult;

    /** Version the text was written for. */
    public final SolcVersion targetVersion;

    SolcAstResult(Map<String, String> sources, ReadResult readResult, SolcVersion targetVersion) {
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        this.readResult = readResult;
        this.targetVersion = targetVersion;
    }

    public Optional<String> text(String absolutePath) {
        return Optional.ofNullable(sources.get(absolutePath));
    }
}
