package info.isaksson.erland.solcast.read.legacy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.solcast.node.NodeCategory;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.read.RawNode;
import info.isaksson.erland.solcast.read.SchemaVariant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Legacy node: scalars under {@code attributes}, node-valued fields appended to {@code children}.
 *
 * <p>An attribute that is JSON {@code null}, or the one-element list {@code [null]}, only announces
 * an absent child or an empty child list; such markers never reach the node's extras.</p>
 */
public final class LegacyRawNode extends RawNode {

    private static final ObjectNode NO_ATTRIBUTES = JsonNodeFactory.instance.objectNode();

    private final ObjectNode attributes;
    private List<LegacyRawNode> children;

    public LegacyRawNode(ObjectNode json, String path) {
        super(json, path);
        JsonNode attrs = json.get("attributes");
        this.attributes = attrs != null && attrs.isObject() ? (ObjectNode) attrs : NO_ATTRIBUTES;
    }

    @Override
    public SchemaVariant variant() {
        return SchemaVariant.LEGACY;
    }

    @Override
    public String kind() {
        JsonNode name = json.get("name");
        return name == null || name.isNull() ? null : name.asText();
    }

    @Override
    protected ObjectNode fields() {
        return attributes;
    }

    @Override
    protected Set<String> structuralKeys() {
        return Collections.emptySet();
    }

    /** Kind of this node, or {@code null} when the tag is unknown. */
    public NodeKind nodeKind() {
        String k = kind();
        return k == null ? null : NodeKind.fromRawName(k);
    }

    public NodeCategory category() {
        NodeKind k = nodeKind();
        return k == null ? null : k.category();
    }

    public boolean is(NodeKind kind) {
        return nodeKind() == kind;
    }

    /** Non-null children in order. */
    public List<LegacyRawNode> children() {
        if (children == null) {
            List<LegacyRawNode> out = new ArrayList<>();
            JsonNode arr = json.get("children");
            if (arr != null && arr.isArray()) {
                for (int i = 0; i < arr.size(); i++) {
                    JsonNode c = arr.get(i);
                    if (c == null || c.isNull()) continue;
                    if (!c.isObject()) throw shapeError("child " + i + " is not an object");
                    out.add(new LegacyRawNode((ObjectNode) c, pointer(path(), "children", i)));
                }
            }
            children = Collections.unmodifiableList(out);
        }
        return children;
    }

    /**
     * Children in order with {@code null} kept in place of every JSON {@code null} entry, for the
     * fields where an entry may be a syntactic hole, such as the components of {@code (, x)}.
     * A lone {@code [null]} still means an empty list.
     */
    public List<LegacyRawNode> childrenWithHoles() {
        JsonNode arr = json.get("children");
        if (arr == null || !arr.isArray() || isNullList(arr)) return List.of();
        List<LegacyRawNode> out = new ArrayList<>();
        Iterator<LegacyRawNode> present = children().iterator();
        for (int i = 0; i < arr.size(); i++) {
            out.add(arr.get(i).isNull() ? null : present.next());
        }
        return Collections.unmodifiableList(out);
    }

    public ChildCursor cursor() {
        return new ChildCursor(this);
    }

    @Override
    public Map<String, JsonNode> leftovers() {
        Map<String, JsonNode> out = super.leftovers();
        Iterator<Map.Entry<String, JsonNode>> it = out.entrySet().iterator();
        while (it.hasNext()) {
            JsonNode v = it.next().getValue();
            if (v.isNull() || isNullList(v)) it.remove();
        }
        return out;
    }
}
