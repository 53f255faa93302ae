package info.isaksson.erland.solcast.node.expr;

import info.isaksson.erland.solcast.node.LiteralKind;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

public final class Literal extends Expression {

    private LiteralKind literalKind;
    private String value;
    private String hexValue;
    private String subdenomination;

    public Literal(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    public void setLiteralKind(LiteralKind literalKind) {
        this.literalKind = literalKind;
    }

    /** Decoded value; {@code null} for strings that are not valid UTF-8. */
    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getHexValue() {
        return hexValue;
    }

    public void setHexValue(String hexValue) {
        this.hexValue = hexValue;
    }

    /** Unit suffix such as {@code ether} or {@code days}, else {@code null}. */
    public String getSubdenomination() {
        return subdenomination;
    }

    public void setSubdenomination(String subdenomination) {
        this.subdenomination = subdenomination;
    }
}
