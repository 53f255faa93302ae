package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.List;

public final class Identifier extends Expression {

    private String name;
    private NodeRef referencedDeclaration;
    private List<NodeRef> overloadedDeclarations = List.of();

    public Identifier(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER;
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

    public List<NodeRef> getOverloadedDeclarations() {
        return overloadedDeclarations;
    }

    public void setOverloadedDeclarations(List<NodeRef> overloadedDeclarations) {
        this.overloadedDeclarations = overloadedDeclarations == null ? List.of() : List.copyOf(overloadedDeclarations);
    }
}
