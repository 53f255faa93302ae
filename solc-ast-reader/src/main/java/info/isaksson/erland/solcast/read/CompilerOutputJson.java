package info.isaksson.erland.solcast.read;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.solcast.error.CompileDataMalformedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads solc output files into a {@link CompilerOutput}.
 *
 * <p>Understood shapes:</p>
 * <ul>
 *   <li>standard-JSON output: {@code sources.<path>.{id, ast}} (or {@code legacyAST} before 0.8),
 *   version under {@code compiler.version} when a caller embedded it</li>
 *   <li>combined-JSON output ({@code --combined-json ast}): {@code sources.<path>.AST},
 *   {@code version}</li>
 * </ul>
 * When a source carries both {@code ast} and {@code legacyAST}, the compact one is used.
 */
public final class CompilerOutputJson {

    private static final ObjectMapper MAPPER = createMapper();

    private CompilerOutputJson() {}

    public static CompilerOutput read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return fromTree(MAPPER.readTree(in));
        }
    }

    /** Parse compiler output from a JSON string. */
    public static CompilerOutput readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return fromTree(MAPPER.readTree(json));
    }

    /** Parses a single raw AST (one source unit) from a JSON string. */
    public static JsonNode readAst(String json) throws JsonProcessingException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readTree(json);
    }

    public static CompilerOutput fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new CompileDataMalformedException("Compiler output is not a JSON object", "", null);
        }
        CompilerOutput out = new CompilerOutput();
        out.setCompilerVersion(version(root));

        JsonNode sources = root.get("sources");
        if (sources == null || !sources.isObject()) {
            throw new CompileDataMalformedException("Compiler output has no 'sources' object", "/sources",
                    root.toString());
        }
        Iterator<Map.Entry<String, JsonNode>> it = sources.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String path = e.getKey();
            JsonNode entry = e.getValue();
            String base = RawNode.pointer(RawNode.pointer("", "sources"), path);
            if (entry == null || !entry.isObject()) {
                throw new CompileDataMalformedException("Source entry is not an object", base, String.valueOf(entry));
            }
            String key = entry.has("ast") ? "ast" : entry.has("legacyAST") ? "legacyAST" : "AST";
            JsonNode ast = entry.get(key);
            Integer id = entry.hasNonNull("id") && entry.get("id").canConvertToInt() ? entry.get("id").asInt() : null;
            out.addSource(new CompilerOutput.Source(path, ast, id, RawNode.pointer(base, key), null));
        }

        boolean versionFromCompiler = out.getCompilerVersion() != null && !root.path("version").isTextual();
        Iterator<Map.Entry<String, JsonNode>> top = root.fields();
        while (top.hasNext()) {
            Map.Entry<String, JsonNode> e = top.next();
            String key = e.getKey();
            if (key.equals("sources") || key.equals("version")) continue;
            JsonNode value = e.getValue();
            if (key.equals("compiler") && versionFromCompiler) {
                // the version is written back at the top level
                ObjectNode rest = ((ObjectNode) value).deepCopy();
                rest.remove("version");
                if (rest.isEmpty()) continue;
                value = rest;
            }
            out.putAuxiliary(key, value);
        }
        return out;
    }

    /** Serializes the output back in standard-JSON shape; key order is stable. */
    public static String toJsonString(CompilerOutput output) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        for (Map.Entry<String, JsonNode> e : output.getAuxiliary().entrySet()) root.set(e.getKey(), e.getValue());
        ObjectNode sources = root.putObject("sources");
        for (CompilerOutput.Source s : output.orderedSources()) {
            ObjectNode entry = sources.putObject(s.path);
            if (s.sourceId != null) entry.put("id", s.sourceId);
            entry.set("ast", s.ast);
        }
        if (output.getCompilerVersion() != null) root.put("version", output.getCompilerVersion());
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
    }

    private static String version(JsonNode root) {
        JsonNode v = root.get("version");
        if (v != null && v.isTextual()) return v.asText();
        JsonNode compiler = root.get("compiler");
        if (compiler != null && compiler.hasNonNull("version")) return compiler.get("version").asText();
        return null;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        return om;
    }
}
