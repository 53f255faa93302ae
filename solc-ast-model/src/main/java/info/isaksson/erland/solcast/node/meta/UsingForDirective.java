package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.type.TypeName;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code using L for T;}, {@code using L for *;} and (0.8.13+) {@code using {f, g} for T global;}.
 *
 * <p>Either {@code libraryName} or {@code functionList} is set. {@code operators} runs parallel to
 * {@code functionList} and holds the user-defined operator bound by an entry, or {@code null}.</p>
 */
public final class UsingForDirective extends AstNode {

    private final Slot<AstNode> libraryName = slot(AstNode.class);
    private final NodeList<IdentifierPath> functionList = list(IdentifierPath.class);
    private List<String> operators = new ArrayList<>();
    private final Slot<TypeName> typeName = slot(TypeName.class);
    private boolean global;

    public UsingForDirective(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USING_FOR_DIRECTIVE;
    }

    public AstNode getLibraryName() {
        return libraryName.get();
    }

    public void setLibraryName(AstNode libraryName) {
        this.libraryName.set(libraryName);
    }

    public NodeList<IdentifierPath> getFunctionList() {
        return functionList;
    }

    public List<String> getOperators() {
        return operators;
    }

    public void setOperators(List<String> operators) {
        this.operators = operators == null ? new ArrayList<>() : new ArrayList<>(operators);
    }

    /** Bound type; {@code null} for {@code *}. */
    public TypeName getTypeName() {
        return typeName.get();
    }

    public void setTypeName(TypeName typeName) {
        this.typeName.set(typeName);
    }

    public boolean isGlobal() {
        return global;
    }

    public void setGlobal(boolean global) {
        this.global = global;
    }
}
