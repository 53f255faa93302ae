package info.isaksson.erland.solcast.read;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.solcast.error.UnsupportedNodeShapeException;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only view of one raw JSON node, as handed to a processor.
 *
 * <p>Scalar fields are read through {@link #field(String)} and its typed helpers; every field read
 * that way is marked consumed, and the remaining ones end up in the node's extras. Each raw node
 * knows its JSON-pointer path from the compiler output root, used for error reporting.</p>
 */
public abstract class RawNode {

    protected final ObjectNode json;
    private final String path;
    private final Set<String> consumed = new HashSet<>();

    protected RawNode(ObjectNode json, String path) {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        this.json = json;
        this.path = path;
    }

    public abstract SchemaVariant variant();

    /** Raw kind tag ({@code nodeType} or {@code name}). */
    public abstract String kind();

    /** Object holding the scalar fields of this node. */
    protected abstract ObjectNode fields();

    /** Top-level keys that describe the node itself and never go to extras. */
    protected abstract Set<String> structuralKeys();

    public final String path() {
        return path;
    }

    public final ObjectNode json() {
        return json;
    }

    public final long id() {
        JsonNode id = json.get("id");
        if (id == null || !id.canConvertToLong()) throw shapeError("missing or non-numeric 'id'");
        return id.asLong();
    }

    public final SourceRange src() {
        JsonNode src = json.get("src");
        if (src == null || src.isNull()) return null;
        try {
            return SourceRange.parse(src.asText());
        } catch (IllegalArgumentException e) {
            throw shapeError("invalid 'src': " + e.getMessage());
        }
    }

    /** True if the field is present, even when it is JSON {@code null}. Does not consume it. */
    public final boolean has(String name) {
        return fields().has(name);
    }

    /** True if the field is present and explicitly JSON {@code null}. Does not consume it. */
    public final boolean isExplicitNull(String name) {
        JsonNode v = fields().get(name);
        return v != null && v.isNull();
    }

    /** Raw field value, or {@code null} when absent or JSON {@code null}. Marks the field consumed. */
    public final JsonNode field(String name) {
        consumed.add(name);
        JsonNode v = fields().get(name);
        return v == null || v.isNull() ? null : v;
    }

    /** Marks fields consumed without reading them. */
    public final void ignore(String... names) {
        Collections.addAll(consumed, names);
    }

    public final String string(String name) {
        JsonNode v = field(name);
        return v == null ? null : v.asText();
    }

    public final String requireString(String name) {
        String v = string(name);
        if (v == null) throw shapeError("missing required field '" + name + "'");
        return v;
    }

    public final Boolean boolOrNull(String name) {
        JsonNode v = field(name);
        if (v == null) return null;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isTextual()) return Boolean.parseBoolean(v.asText());
        throw shapeError("field '" + name + "' is not a boolean");
    }

    public final boolean bool(String name, boolean defaultValue) {
        Boolean b = boolOrNull(name);
        return b == null ? defaultValue : b;
    }

    public final Long longOrNull(String name) {
        JsonNode v = field(name);
        if (v == null) return null;
        if (!v.canConvertToLong()) throw shapeError("field '" + name + "' is not an integer");
        return v.asLong();
    }

    /** String list; {@code [null]} and absent fields read as empty lists, null entries are kept. */
    public final List<String> strings(String name) {
        JsonNode v = field(name);
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        if (!v.isArray()) throw shapeError("field '" + name + "' is not a list");
        if (isNullList(v)) return out;
        for (JsonNode e : v) out.add(e.isNull() ? null : e.asText());
        return out;
    }

    /** Identity list; null entries are kept as {@code null}. */
    public final List<Long> ids(String name) {
        JsonNode v = field(name);
        List<Long> out = new ArrayList<>();
        if (v == null) return out;
        if (!v.isArray()) throw shapeError("field '" + name + "' is not a list");
        for (JsonNode e : v) {
            if (e.isNull()) out.add(null);
            else if (e.canConvertToLong()) out.add(e.asLong());
            else throw shapeError("field '" + name + "' holds a non-numeric identity");
        }
        return out;
    }

    /** Fields no processor consumed, in key order. */
    public Map<String, JsonNode> leftovers() {
        Map<String, JsonNode> out = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = fields().fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!consumed.contains(e.getKey()) && !structuralKeys().contains(e.getKey())) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    public final String fragment() {
        return json.toString();
    }

    public final UnsupportedNodeShapeException shapeError(String reason) {
        return new UnsupportedNodeShapeException(reason, kind(), variant().label(), path, fragment());
    }

    /** The legacy encoding of an empty list. */
    protected static boolean isNullList(JsonNode v) {
        return v.isArray() && v.size() == 1 && v.get(0).isNull();
    }

    /** Appends a JSON-pointer reference token to a path. */
    public static String pointer(String base, String token) {
        return base + "/" + token.replace("~", "~0").replace("/", "~1");
    }

    public static String pointer(String base, String token, int index) {
        return pointer(base, token) + "/" + index;
    }

    @Override
    public String toString() {
        return kind() + "@" + path;
    }
}
