package info.isaksson.erland.solcast.node.type;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.Slot;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.node.expr.Expression;

public final class ArrayTypeName extends TypeName {

    private final Slot<TypeName> baseType = requiredSlot(TypeName.class);
    private final Slot<Expression> length = slot(Expression.class);

    public ArrayTypeName(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY_TYPE_NAME;
    }

    public TypeName getBaseType() {
        return baseType.get();
    }

    public void setBaseType(TypeName baseType) {
        this.baseType.set(baseType);
    }

    public Expression getLength() {
        return length.get();
    }

    public void setLength(Expression length) {
        this.length.set(length);
    }
}
