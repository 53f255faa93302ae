package info.isaksson.erland.solcast.node.type;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.meta.IdentifierPath;

/**
 * Reference to a contract, struct, enum or user-defined value type. From 0.8.0 the name is
 * carried by an {@link IdentifierPath} child.
 */
public final class UserDefinedTypeName extends TypeName {

    private String name;
    private final Slot<IdentifierPath> pathNode = slot(IdentifierPath.class);
    private NodeRef referencedDeclaration;
    private NodeRef contractScope;

    public UserDefinedTypeName(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USER_DEFINED_TYPE_NAME;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public IdentifierPath getPathNode() {
        return pathNode.get();
    }

    public void setPathNode(IdentifierPath pathNode) {
        this.pathNode.set(pathNode);
    }

    public NodeRef getReferencedDeclaration() {
        return referencedDeclaration;
    }

    public void setReferencedDeclaration(NodeRef referencedDeclaration) {
        this.referencedDeclaration = referencedDeclaration;
    }

    public NodeRef getContractScope() {
        return contractScope;
    }

    public void setContractScope(NodeRef contractScope) {
        this.contractScope = contractScope;
    }
}
