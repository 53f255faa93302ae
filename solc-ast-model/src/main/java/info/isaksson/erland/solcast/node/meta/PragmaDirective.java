package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.List;

/** {@code pragma solidity ^0.8.0;} Literals are the raw pragma tokens. */
public final class PragmaDirective extends AstNode {

    private List<String> literals = List.of();

    public PragmaDirective(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PRAGMA_DIRECTIVE;
    }

    public List<String> getLiterals() {
        return literals;
    }

    public void setLiterals(List<String> literals) {
        this.literals = literals == null ? List.of() : List.copyOf(literals);
    }
}
