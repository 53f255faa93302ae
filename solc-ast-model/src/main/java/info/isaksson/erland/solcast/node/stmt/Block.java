package info.isaksson.erland.solcast.node.stmt;

import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;

public final class Block extends Statement {

    private final NodeList<Statement> statements = list(Statement.class);

    public Block(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BLOCK;
    }

    public NodeList<Statement> getStatements() {
        return statements;
    }
}
