package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.context.NodeRef;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.List;

/** {@code import "a.sol";}, {@code import "a.sol" as A;}, {@code import {X as Y} from "a.sol";} */
public final class ImportDirective extends AstNode {

    private String file;
    private String absolutePath;
    private String unitAlias;
    private NodeRef sourceUnit;
    private NodeRef scope;
    private List<SymbolAlias> symbolAliases = List.of();

    public ImportDirective(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_DIRECTIVE;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public String getAbsolutePath() {
        return absolutePath;
    }

    public void setAbsolutePath(String absolutePath) {
        this.absolutePath = absolutePath;
    }

    /** Alias of {@code import ... as A}; empty or {@code null} when absent. */
    public String getUnitAlias() {
        return unitAlias;
    }

    public void setUnitAlias(String unitAlias) {
        this.unitAlias = unitAlias;
    }

    public NodeRef getSourceUnit() {
        return sourceUnit;
    }

    public void setSourceUnit(NodeRef sourceUnit) {
        this.sourceUnit = sourceUnit;
    }

    public NodeRef getScope() {
        return scope;
    }

    public void setScope(NodeRef scope) {
        this.scope = scope;
    }

    public List<SymbolAlias> getSymbolAliases() {
        return symbolAliases;
    }

    public void setSymbolAliases(List<SymbolAlias> symbolAliases) {
        this.symbolAliases = symbolAliases == null ? List.of() : List.copyOf(symbolAliases);
    }
}
