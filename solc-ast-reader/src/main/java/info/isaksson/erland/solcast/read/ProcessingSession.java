package info.isaksson.erland.solcast.read;

import info.isaksson.erland.solcast.context.AstContext;
import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.error.DuplicateIdentityException;
import info.isaksson.erland.solcast.error.MalformedTypeStringException;
import info.isaksson.erland.solcast.error.SolcAstException;
import info.isaksson.erland.solcast.error.UnsupportedNodeShapeException;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.types.TypeDescriptions;
import info.isaksson.erland.solcast.types.TypeDescriptor;
import info.isaksson.erland.solcast.types.TypeStringParser;
import info.isaksson.erland.solcast.version.SolcVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * State of one schema-specific tree build: the shared context, the processor table of the schema
 * family and the read options.
 *
 * <p>{@link #build(RawNode)} dispatches a raw node to its processor, copies unconsumed fields into
 * the node's extras and attaches location information (path, raw fragment) to failures.</p>
 */
public final class ProcessingSession<R extends RawNode> {

    private static final Logger log = LoggerFactory.getLogger(ProcessingSession.class);

    private final AstContext context;
    private final Map<NodeKind, NodeProcessor<R>> processors;
    private final ReadOptions options;
    private final SolcVersion compilerVersion;
    private final SchemaVariant variant;
    private int built;
    private int toleratedTypeStrings;

    public ProcessingSession(AstContext context, Map<NodeKind, NodeProcessor<R>> processors,
                             ReadOptions options, SolcVersion compilerVersion, SchemaVariant variant) {
        if (context == null) throw new IllegalArgumentException("context must not be null");
        if (processors == null) throw new IllegalArgumentException("processors must not be null");
        this.context = context;
        this.processors = processors;
        this.options = options == null ? ReadOptions.defaults() : options;
        this.compilerVersion = compilerVersion;
        this.variant = variant;
    }

    public AstContext context() {
        return context;
    }

    public ReadOptions options() {
        return options;
    }

    /** Compiler version of the output being read, or {@code null} when unknown. */
    public SolcVersion compilerVersion() {
        return compilerVersion;
    }

    public SchemaVariant variant() {
        return variant;
    }

    /** Number of nodes built so far. */
    public int builtCount() {
        return built;
    }

    public int toleratedTypeStringCount() {
        return toleratedTypeStrings;
    }

    /** Builds the subtree rooted at the raw node. */
    public AstNode build(R raw) {
        NodeKind kind = NodeKind.fromRawName(raw.kind());
        if (kind == null) throw raw.shapeError("unknown node kind '" + raw.kind() + "'");
        NodeProcessor<R> processor = processors.get(kind);
        if (processor == null) throw raw.shapeError("node kind '" + raw.kind() + "' does not occur in this schema");

        AstNode node;
        try {
            node = processor.process(raw, this);
        } catch (MalformedTypeStringException e) {
            throw e.getNodePath() == null ? e.locatedAt(raw.kind(), raw.path(), raw.fragment()) : e;
        } catch (DuplicateIdentityException e) {
            throw e.getNodePath() == null ? e.locatedAt(raw.path(), raw.fragment()) : e;
        } catch (SolcAstException e) {
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new UnsupportedNodeShapeException(e.getMessage(), raw.kind(), variant.label(),
                    raw.path(), raw.fragment(), e);
        }
        node.getExtras().putAll(raw.leftovers());
        built++;
        return node;
    }

    /** Builds a child and checks that it has the type the parent field requires. */
    public <T extends AstNode> T build(R raw, Class<T> type) {
        AstNode node = build(raw);
        if (!type.isInstance(node)) {
            throw raw.shapeError("expected a " + type.getSimpleName() + " but found " + raw.kind());
        }
        return type.cast(node);
    }

    public <T extends AstNode> T buildOrNull(R raw, Class<T> type) {
        return raw == null ? null : build(raw, type);
    }

    public <T extends AstNode> List<T> buildAll(List<R> raws, Class<T> type) {
        List<T> out = new ArrayList<>(raws.size());
        for (R r : raws) out.add(r == null ? null : build(r, type));
        return out;
    }

    /** Creates the node for a raw node and registers it, before any of its children exist. */
    public <T extends AstNode> T open(R raw, NodeFactory<T> factory) {
        T node = factory.create(raw.id(), raw.src());
        context.register(node);
        return node;
    }

    /** Tracked reference, or {@code null} when the identity is absent. */
    public NodeRef ref(Long id) {
        return id == null ? null : context.reference(id);
    }

    public List<NodeRef> refs(List<Long> ids) {
        List<NodeRef> out = new ArrayList<>(ids.size());
        for (Long id : ids) {
            if (id != null) out.add(context.reference(id));
        }
        return out;
    }

    /**
     * Parses a type annotation. With {@link ReadOptions#tolerateMalformedTypeStrings} a malformed
     * string yields an opaque descriptor instead of failing the read.
     */
    public TypeDescriptions types(R raw, String typeString, String typeIdentifier) {
        if (typeString == null && typeIdentifier == null) return null;
        TypeDescriptor descriptor = null;
        if (typeString != null) {
            try {
                descriptor = TypeStringParser.parse(typeString);
            } catch (MalformedTypeStringException e) {
                if (!options.tolerateMalformedTypeStrings) {
                    throw e.locatedAt(raw.kind(), raw.path(), raw.fragment());
                }
                toleratedTypeStrings++;
                log.debug("Keeping malformed type string opaque at {}: {}", raw.path(), e.getMessage());
                descriptor = TypeDescriptor.opaque(typeString);
            }
        }
        return new TypeDescriptions(typeString, typeIdentifier, descriptor);
    }
}
