package info.isaksson.erland.solcast.read;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.meta.SymbolAlias;
import info.isaksson.erland.solcast.types.TypeDescriptions;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Field readers shared by both processor families. */
public final class RawFields {

    private RawFields() {
    }

    /** {@code {"typeString": ..., "typeIdentifier": ...}} object, or {@code null}. */
    public static <R extends RawNode> TypeDescriptions descriptions(JsonNode obj, R raw, ProcessingSession<R> s) {
        if (obj == null || obj.isNull()) return null;
        if (obj.isTextual()) return s.types(raw, obj.asText(), null);
        if (!obj.isObject()) throw raw.shapeError("type description is neither an object nor a string");
        return s.types(raw, text(obj, "typeString"), text(obj, "typeIdentifier"));
    }

    public static <R extends RawNode> List<TypeDescriptions> argumentTypes(R raw, ProcessingSession<R> s) {
        JsonNode v = raw.field("argumentTypes");
        List<TypeDescriptions> out = new ArrayList<>();
        if (v == null || !v.isArray()) return out;
        for (JsonNode e : v) {
            if (!e.isNull()) out.add(descriptions(e, raw, s));
        }
        return out;
    }

    /** {@code exportedSymbols}: symbol name to declaration identities, sorted by name. */
    public static Map<String, List<Long>> exportedSymbols(RawNode raw) {
        JsonNode v = raw.field("exportedSymbols");
        Map<String, List<Long>> out = new TreeMap<>();
        if (v == null) return out;
        if (!v.isObject()) throw raw.shapeError("'exportedSymbols' is not an object");
        Iterator<Map.Entry<String, JsonNode>> it = v.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            List<Long> ids = new ArrayList<>();
            for (JsonNode id : e.getValue()) {
                if (id.canConvertToLong()) ids.add(id.asLong());
            }
            out.put(e.getKey(), List.copyOf(ids));
        }
        return out;
    }

    /**
     * {@code symbolAliases} of an import. Before 0.6 the foreign symbol is a bare identity; later
     * it is an identifier object whose name is kept and whose own identity is not registered.
     */
    public static <R extends RawNode> List<SymbolAlias> symbolAliases(R raw, ProcessingSession<R> s) {
        JsonNode v = raw.field("symbolAliases");
        List<SymbolAlias> out = new ArrayList<>();
        if (v == null || !v.isArray()) return out;
        for (JsonNode a : v) {
            if (a.isNull()) continue;
            JsonNode foreign = a.get("foreign");
            String local = text(a, "local");
            SourceRange nameLocation = a.hasNonNull("nameLocation") ? SourceRange.parse(a.get("nameLocation").asText()) : null;
            if (foreign == null || foreign.isNull()) {
                throw raw.shapeError("symbol alias without 'foreign'");
            } else if (foreign.canConvertToLong()) {
                out.add(SymbolAlias.of(null, s.ref(foreign.asLong()), local, nameLocation));
            } else if (foreign.isObject()) {
                JsonNode refId = foreign.get("referencedDeclaration");
                Long target = refId != null && refId.canConvertToLong() ? refId.asLong() : null;
                out.add(SymbolAlias.of(text(foreign, "name"), s.ref(target), local, nameLocation));
            } else {
                out.add(SymbolAlias.of(foreign.asText(), null, local, nameLocation));
            }
        }
        return out;
    }

    public static SourceRange range(RawNode raw, String name) {
        String v = raw.string(name);
        if (v == null) return null;
        try {
            return SourceRange.parse(v);
        } catch (IllegalArgumentException e) {
            throw raw.shapeError("invalid source range in '" + name + "': " + e.getMessage());
        }
    }

    static String text(JsonNode obj, String name) {
        JsonNode v = obj.get(name);
        return v == null || v.isNull() ? null : v.asText();
    }
}
