package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.SourceRange;

/** Base of statements. */
public abstract class Statement extends AstNode {

    private String documentation;

    protected Statement(long id, SourceRange source) {
        super(id, source);
    }

    /** Statement-level NatSpec (0.7.2+ compact schema), or {@code null}. */
    public String getDocumentation() {
        return documentation;
    }

    public void setDocumentation(String documentation) {
        this.documentation = documentation;
    }
}
