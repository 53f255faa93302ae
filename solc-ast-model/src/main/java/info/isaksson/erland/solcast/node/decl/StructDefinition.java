package info.isaksson.erland.solcast.node.decl;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.Visibility;

public final class StructDefinition extends Declaration {

    private String canonicalName;
    private Visibility visibility;
    private final NodeList<VariableDeclaration> members = list(VariableDeclaration.class);

    public StructDefinition(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STRUCT_DEFINITION;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public void setCanonicalName(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }

    public NodeList<VariableDeclaration> getMembers() {
        return members;
    }
}
