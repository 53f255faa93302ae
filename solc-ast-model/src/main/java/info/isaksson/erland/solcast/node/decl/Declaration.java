package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.meta.StructuredDocumentation;

/**
 * Base of named declarations. Documentation is kept as plain text; from 0.6.3 the compact
 * schema also carries it as a {@link StructuredDocumentation} node, which is kept as a child.
 */
public abstract class Declaration extends AstNode {

    private String name;
    private SourceRange nameLocation;
    private NodeRef scope;
    private String documentation;
    private final Slot<StructuredDocumentation> documentationNode = slot(StructuredDocumentation.class);

    protected Declaration(long id, SourceRange source) {
        super(id, source);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** Location of the name token (0.8.2+), or {@code null}. */
    public SourceRange getNameLocation() {
        return nameLocation;
    }

    public void setNameLocation(SourceRange nameLocation) {
        this.nameLocation = nameLocation;
    }

    /** Enclosing scope node. */
    public NodeRef getScope() {
        return scope;
    }

    public void setScope(NodeRef scope) {
        this.scope = scope;
    }

    /** NatSpec text without comment markers, or {@code null}. */
    public String getDocumentation() {
        return documentation;
    }

    public void setDocumentation(String documentation) {
        this.documentation = documentation;
    }

    public StructuredDocumentation getDocumentationNode() {
        return documentationNode.get();
    }

    public void setDocumentationNode(StructuredDocumentation documentationNode) {
        this.documentationNode.set(documentationNode);
    }
}
