package info.isaksson.erland.solcast.read;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.solcast.error.CompileDataMalformedException;

/** Decides which schema a raw AST root uses. */
public final class SchemaDetector {

    private SchemaDetector() {}

    /**
     * {@code nodeType} present means the compact schema; {@code name} together with
     * {@code attributes} or {@code children} means the legacy one.
     *
     * @throws CompileDataMalformedException if the root is missing, not an object or untagged
     */
    public static SchemaVariant detect(JsonNode root, String path) {
        if (root == null || root.isNull()) {
            throw new CompileDataMalformedException("Source has no AST", path, null);
        }
        if (!root.isObject()) {
            throw new CompileDataMalformedException("AST root is not a JSON object", path, root.toString());
        }
        if (root.hasNonNull("nodeType")) return SchemaVariant.MODERN;
        if (root.hasNonNull("name") && (root.has("attributes") || root.has("children"))) return SchemaVariant.LEGACY;
        throw new CompileDataMalformedException("AST root carries no kind tag ('nodeType' or 'name')", path,
                root.toString());
    }
}
