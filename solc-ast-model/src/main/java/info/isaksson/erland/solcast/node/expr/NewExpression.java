package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.type.TypeName;

public final class NewExpression extends Expression {

    private final Slot<TypeName> typeName = requiredSlot(TypeName.class);

    public NewExpression(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NEW_EXPRESSION;
    }

    public TypeName getTypeName() {
        return typeName.get();
    }

    public void setTypeName(TypeName typeName) {
        this.typeName.set(typeName);
    }
}
