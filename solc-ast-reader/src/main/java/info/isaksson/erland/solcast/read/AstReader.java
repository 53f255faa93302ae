package info.isaksson.erland.solcast.read;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.error.CompileDataMalformedException;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.postprocess.PostprocessorPipeline;
import info.isaksson.erland.solcast.read.legacy.LegacyProcessors;
import info.isaksson.erland.solcast.read.legacy.LegacyRawNode;
import info.isaksson.erland.solcast.read.modern.ModernProcessors;
import info.isaksson.erland.solcast.read.modern.ModernRawNode;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw compiler output into normalized trees.
 *
 * <p>All sources of one output share a single {@link AstContext}, because identities are unique
 * per compiler invocation and references cross source boundaries. A failure anywhere aborts the
 * whole read; no partial result is returned.</p>
 */
public final class AstReader {

    private static final Logger log = LoggerFactory.getLogger(AstReader.class);

    private final ReadOptions options;

    public AstReader() {
        this(ReadOptions.defaults());
    }

    public AstReader(ReadOptions options) {
        this.options = options == null ? ReadOptions.defaults() : options;
    }

    public ReadResult read(CompilerOutput output) {
        if (output == null) throw new IllegalArgumentException("output must not be null");
        if (output.getSources().isEmpty()) {
            throw new CompileDataMalformedException("Compiler output contains no sources", "/sources", null);
        }
        SolcVersion version = version(output.getCompilerVersion());
        AstContext context = new AstContext();
        List<SourceUnit> units = new ArrayList<>();
        Map<String, SchemaVariant> variants = new LinkedHashMap<>();
        int tolerated = 0;

        // 1) Build one tree per source, in source id order
        for (CompilerOutput.Source source : output.orderedSources()) {
            SchemaVariant variant = SchemaDetector.detect(source.ast, source.pointer);
            checkRoot(source, variant);
            log.debug("Reading {} with the {} schema", source.path, variant.label());

            SourceUnit unit;
            if (variant == SchemaVariant.LEGACY) {
                ProcessingSession<LegacyRawNode> session =
                        new ProcessingSession<>(context, LegacyProcessors.table(), options, version, variant);
                unit = (SourceUnit) session.build(new LegacyRawNode((ObjectNode) source.ast, source.pointer));
                tolerated += session.toleratedTypeStringCount();
            } else {
                ProcessingSession<ModernRawNode> session =
                        new ProcessingSession<>(context, ModernProcessors.table(), options, version, variant);
                unit = (SourceUnit) session.build(new ModernRawNode((ObjectNode) source.ast, source.pointer));
                tolerated += session.toleratedTypeStringCount();
            }
            if (unit.getAbsolutePath() == null) unit.setAbsolutePath(source.path);
            if (source.content != null) unit.setSourceHash(sha256(source.content));
            units.add(unit);
            variants.put(source.path, variant);
        }

        // 2) Identities are final; references may be resolved from here on
        context.closeRegistration();

        // 3) Normalize across schema versions
        PostprocessorPipeline pipeline = options.pipeline == null ? PostprocessorPipeline.standard() : options.pipeline;
        pipeline.run(units, context, version);

        log.debug("Read {} source unit(s), {} node(s)", units.size(), context.size());
        return new ReadResult(units, context, version, output.getCompilerVersion(), variants, tolerated);
    }

    private SolcVersion version(String text) {
        if (text == null || text.isBlank()) return options.assumedVersion;
        try {
            return SolcVersion.parse(text);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unparseable compiler version '{}'", text);
            return options.assumedVersion;
        }
    }

    /** The root must be a SourceUnit with a top-level node list. */
    private static void checkRoot(CompilerOutput.Source source, SchemaVariant variant) {
        JsonNode root = source.ast;
        String kind = variant == SchemaVariant.LEGACY ? text(root, "name") : text(root, "nodeType");
        if (!NodeKind.SOURCE_UNIT.rawName().equals(kind)) {
            throw new CompileDataMalformedException("AST root of " + source.path + " is a " + kind
                    + ", not a SourceUnit", source.pointer, root.toString());
        }
        String listField = variant == SchemaVariant.LEGACY ? "children" : "nodes";
        JsonNode list = root.get(listField);
        if (list == null || !list.isArray()) {
            throw new CompileDataMalformedException("SourceUnit of " + source.path + " has no top-level node list ('"
                    + listField + "')", source.pointer, root.toString());
        }
    }

    private static String text(JsonNode obj, String field) {
        JsonNode v = obj.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static String sha256(String content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
