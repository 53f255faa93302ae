package info.isaksson.erland.solcast.read.modern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.solcast.read.RawNode;
import info.isaksson.erland.solcast.read.SchemaVariant;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Compact node: every field, scalar or node-valued, is a named member of the object. */
public final class ModernRawNode extends RawNode {

    private static final Set<String> STRUCTURAL = Set.of("id", "nodeType", "src");

    public ModernRawNode(ObjectNode json, String path) {
        super(json, path);
    }

    @Override
    public SchemaVariant variant() {
        return SchemaVariant.MODERN;
    }

    @Override
    public String kind() {
        JsonNode t = json.get("nodeType");
        return t == null || t.isNull() ? null : t.asText();
    }

    @Override
    protected ObjectNode fields() {
        return json;
    }

    @Override
    protected Set<String> structuralKeys() {
        return STRUCTURAL;
    }

    /** Node-valued field, or {@code null} when absent or JSON {@code null}. */
    public ModernRawNode child(String name) {
        JsonNode v = field(name);
        if (v == null) return null;
        if (!v.isObject()) throw shapeError("field '" + name + "' is not a node");
        return new ModernRawNode((ObjectNode) v, pointer(path(), name));
    }

    public ModernRawNode requireChild(String name) {
        ModernRawNode c = child(name);
        if (c == null) throw shapeError("missing required field '" + name + "'");
        return c;
    }

    /** True if the field holds a list, as opposed to being absent or {@code null}. */
    public boolean isList(String name) {
        JsonNode v = fields().get(name);
        return v != null && v.isArray();
    }

    /** Node list; JSON {@code null} entries stay {@code null}, an absent field reads as empty. */
    public List<ModernRawNode> children(String name) {
        JsonNode v = field(name);
        List<ModernRawNode> out = new ArrayList<>();
        if (v == null) return out;
        if (!v.isArray()) throw shapeError("field '" + name + "' is not a list");
        for (int i = 0; i < v.size(); i++) {
            JsonNode e = v.get(i);
            if (e == null || e.isNull()) {
                out.add(null);
            } else if (e.isObject()) {
                out.add(new ModernRawNode((ObjectNode) e, pointer(path(), name, i)));
            } else {
                throw shapeError("entry " + i + " of '" + name + "' is not a node");
            }
        }
        return out;
    }

    public List<ModernRawNode> requireChildren(String name) {
        if (!isList(name)) throw shapeError("missing required list '" + name + "'");
        return children(name);
    }
}
