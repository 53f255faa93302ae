package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.SourceRange;
import info.isaksson.erland.solcast.types.TypeDescriptions;

import java.util.List;

/**
 * Base of expressions. The annotation flags are whatever the compiler reported; {@code null}
 * means the schema did not carry the flag.
 */
public abstract class Expression extends AstNode {

    private TypeDescriptions typeDescriptions;
    private List<TypeDescriptions> argumentTypes = List.of();
    private Boolean constant;
    private Boolean pure;
    private Boolean lValue;
    private Boolean lValueRequested;

    protected Expression(long id, SourceRange source) {
        super(id, source);
    }

    public TypeDescriptions getTypeDescriptions() {
        return typeDescriptions;
    }

    public void setTypeDescriptions(TypeDescriptions typeDescriptions) {
        this.typeDescriptions = typeDescriptions;
    }

    public List<TypeDescriptions> getArgumentTypes() {
        return argumentTypes;
    }

    public void setArgumentTypes(List<TypeDescriptions> argumentTypes) {
        this.argumentTypes = argumentTypes == null ? List.of() : List.copyOf(argumentTypes);
    }

    public Boolean getConstant() {
        return constant;
    }

    public void setConstant(Boolean constant) {
        this.constant = constant;
    }

    public Boolean getPure() {
        return pure;
    }

    public void setPure(Boolean pure) {
        this.pure = pure;
    }

    public Boolean getLValue() {
        return lValue;
    }

    public void setLValue(Boolean lValue) {
        this.lValue = lValue;
    }

    public Boolean getLValueRequested() {
        return lValueRequested;
    }

    public void setLValueRequested(Boolean lValueRequested) {
        this.lValueRequested = lValueRequested;
    }
}
