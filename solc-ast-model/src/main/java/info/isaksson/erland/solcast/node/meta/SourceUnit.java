package info.isaksson.erland.solcast.node.meta;

import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.NodeList;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Root of one source file's tree. Owns the top-level declarations and directives in
 * declaration order.
 */
public final class SourceUnit extends AstNode {

    private String absolutePath;
    private String license;
    private String sourceHash;
    private Map<String, List<Long>> exportedSymbols = new TreeMap<>();
    private final NodeList<AstNode> nodes = list(AstNode.class);

    public SourceUnit(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SOURCE_UNIT;
    }

    public String getAbsolutePath() {
        return absolutePath;
    }

    public void setAbsolutePath(String absolutePath) {
        this.absolutePath = absolutePath;
    }

    /** SPDX license identifier (0.6.8+), or {@code null}. */
    public String getLicense() {
        return license;
    }

    public void setLicense(String license) {
        this.license = license;
    }

    /** Hex SHA-256 of the source text when the compiler output carried it, else {@code null}. */
    public String getSourceHash() {
        return sourceHash;
    }

    public void setSourceHash(String sourceHash) {
        this.sourceHash = sourceHash;
    }

    public Map<String, List<Long>> getExportedSymbols() {
        return exportedSymbols;
    }

    public void setExportedSymbols(Map<String, List<Long>> exportedSymbols) {
        this.exportedSymbols = exportedSymbols;
    }

    public NodeList<AstNode> getNodes() {
        return nodes;
    }
}
