package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;

public final class ParameterList extends AstNode {

    private final NodeList<VariableDeclaration> parameters = list(VariableDeclaration.class);

    public ParameterList(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PARAMETER_LIST;
    }

    public NodeList<VariableDeclaration> getParameters() {
        return parameters;
    }
}
