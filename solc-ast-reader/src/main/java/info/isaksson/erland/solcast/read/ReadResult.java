package info.isaksson.erland.solcast.read;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.version.SolcVersion;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Result of {@link AstReader#read(CompilerOutput)}: one tree per source and the shared context. */
public final class ReadResult {
    /** Source units, ordered by source id. */
    public final List<SourceUnit> units;

    public final AstContext context;

    /** Parsed compiler version; {@code null} when the output named none and none was assumed. */
    public final SolcVersion compilerVersion;

    /** Version string as reported by the compiler, e.g. {@code 0.8.19+commit.7dd6d404}. */
    public final String compilerVersionText;

    /** Schema each source was read with, keyed by source path. */
    public final Map<String, SchemaVariant> variants;

    /** Type strings kept as opaque descriptors because they could not be parsed. */
    public final int toleratedTypeStrings;

    ReadResult(List<SourceUnit> units, AstContext context, SolcVersion compilerVersion, String compilerVersionText,
               Map<String, SchemaVariant> variants, int toleratedTypeStrings) {
        this.units = List.copyOf(units);
        this.context = context;
        this.compilerVersion = compilerVersion;
        this.compilerVersionText = compilerVersionText;
        this.variants = Collections.unmodifiableMap(variants);
        this.toleratedTypeStrings = toleratedTypeStrings;
    }

    public Optional<SourceUnit> unit(String absolutePath) {
        for (SourceUnit u : units) {
            if (absolutePath.equals(u.getAbsolutePath())) return Optional.of(u);
        }
        return Optional.empty();
    }
}
