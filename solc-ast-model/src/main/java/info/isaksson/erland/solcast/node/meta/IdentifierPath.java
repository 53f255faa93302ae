package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

/** Dotted name referring to a declaration, e.g. {@code L.S}. Compact schema 0.8.0+. */
public final class IdentifierPath extends AstNode {

    private String name;
    private NodeRef referencedDeclaration;

    public IdentifierPath(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER_PATH;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public NodeRef getReferencedDeclaration() {
        return referencedDeclaration;
    }

    public void setReferencedDeclaration(NodeRef referencedDeclaration) {
        this.referencedDeclaration = referencedDeclaration;
    }
}
