package info.isaksson.erland.solcast.node.type;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.types.TypeDescriptions;

/** Base of type names written in source. */
public abstract class TypeName extends AstNode {

    private TypeDescriptions typeDescriptions;

    protected TypeName(long id, SourceRange source) {
        super(id, source);
    }

    public TypeDescriptions getTypeDescriptions() {
        return typeDescriptions;
    }

    public void setTypeDescriptions(TypeDescriptions typeDescriptions) {
        this.typeDescriptions = typeDescriptions;
    }
}
