package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.type.ElementaryTypeName;

/**
 * Elementary type used as an expression, e.g. {@code uint256(x)} or {@code address(0)}.
 * Compact output before 0.6.0 and the legacy schema report the type as text only.
 */
public final class ElementaryTypeNameExpression extends Expression {

    private final Slot<ElementaryTypeName> typeName = slot(ElementaryTypeName.class);
    private String typeNameText;

    public ElementaryTypeNameExpression(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ELEMENTARY_TYPE_NAME_EXPRESSION;
    }

    public ElementaryTypeName getTypeName() {
        return typeName.get();
    }

    public void setTypeName(ElementaryTypeName typeName) {
        this.typeName.set(typeName);
    }

    public String getTypeNameText() {
        return typeNameText;
    }

    public void setTypeNameText(String typeNameText) {
        this.typeNameText = typeNameText;
    }
}
