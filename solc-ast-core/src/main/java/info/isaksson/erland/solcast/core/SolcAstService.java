package info.isaksson.erland.solcast.core;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.read.AstReader;
import info.isaksson.erland.solcast.read.CompilerOutput;
import info.isaksson.erland.solcast.read.CompilerOutputJson;
import info.isaksson.erland.solcast.read.ReadResult;
import info.isaksson.erland.solcast.version.SolcVersion;
import info.isaksson.erland.solcast.write.SourceWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Core API for normalizing compiler ASTs and regenerating source text.
 *
 * <p>Wrappers should use this class instead of wiring reader and writer themselves.</p>
 */
public final class SolcAstService {
    private static final Logger log = LoggerFactory.getLogger(SolcAstService.class);

    /** Read already-loaded compiler output into normalized trees. */
    public ReadResult read(CompilerOutput output, SolcAstOptions options) {
        if (output == null) throw new IllegalArgumentException("output must not be null");
        if (options == null) options = new SolcAstOptions();

        return new AstReader(options.toReadOptions()).read(output);
    }

    /** Read compiler output from a JSON document. */
    public ReadResult readJson(String json, SolcAstOptions options) throws IOException {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        return read(CompilerOutputJson.readFromString(json), options);
    }

    /** Read compiler output from a JSON file. */
    public ReadResult readJson(Path file, SolcAstOptions options) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        log.debug("Reading compiler output from {}", file);
        return read(CompilerOutputJson.read(file), options);
    }

    /** Write every unit of a read result for the configured (or detected) target version. */
    public SolcAstResult writeAll(ReadResult readResult, SolcAstOptions options) {
        if (readResult == null) throw new IllegalArgumentException("readResult must not be null");
        if (options == null) options = new SolcAstOptions();

        SolcVersion target = targetFor(readResult, options);
        Map<String, String> sources = new LinkedHashMap<>();
        for (SourceUnit unit : readResult.units) {
            String key = unit.getAbsolutePath() != null ? unit.getAbsolutePath() : "#" + unit.getId();
            String text = SourceWriter.write(unit, target, options.formatPolicy, options.mapping);
            if (sources.putIfAbsent(key, text) != null) {
                throw new IllegalStateException("Two source units share the path " + key);
            }
        }
        log.debug("Wrote {} source unit(s) for solc {}", sources.size(), target);
        return new SolcAstResult(sources, readResult, target);
    }

    /** Write a single node, e.g. a contract or a statement, for the configured target version. */
    public String write(AstNode node, SolcAstOptions options) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        if (options == null) options = new SolcAstOptions();

        SolcVersion target = options.targetVersion != null ? options.targetVersion : SolcVersion.LATEST;
        return SourceWriter.write(node, target, options.formatPolicy, options.mapping);
    }

    /** Read a compiler output file and write all of its units back as source text. */
    public SolcAstResult regenerate(Path file, SolcAstOptions options) throws IOException {
        if (options == null) options = new SolcAstOptions();
        return writeAll(readJson(file, options), options);
    }

    private static SolcVersion targetFor(ReadResult readResult, SolcAstOptions options) {
        if (options.targetVersion != null) return options.targetVersion;
        if (readResult.compilerVersion != null) return readResult.compilerVersion;
        log.debug("No compiler version known, writing for solc {}", SolcVersion.LATEST);
        return SolcVersion.LATEST;
    }
}
