package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;

/** {@code unchecked { ... }}, 0.8.0+. */
public final class UncheckedBlock extends Statement {

    private final NodeList<Statement> statements = list(Statement.class);

    public UncheckedBlock(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNCHECKED_BLOCK;
    }

    public NodeList<Statement> getStatements() {
        return statements;
    }
}
