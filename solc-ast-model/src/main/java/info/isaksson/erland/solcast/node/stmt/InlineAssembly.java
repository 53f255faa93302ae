package info.isaksson.erland.solcast.node.stmt;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.solcast.node.NodeKind;
import info.isaksson.erland.solcast.node.SourceRange;

import java.util.List;

/**
 * {@code assembly { ... }}. Before 0.6.0 the compiler only reports the assembly text
 * ({@code operations}); later versions report a Yul AST, kept here as raw JSON.
 */
public final class InlineAssembly extends Statement {

    private String operations;
    private JsonNode yulAst;
    private String evmVersion;
    private List<String> flags = List.of();
    private JsonNode externalReferences;

    public InlineAssembly(long id, SourceRange source) {
        super(id, source);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INLINE_ASSEMBLY;
    }

    public String getOperations() {
        return operations;
    }

    public void setOperations(String operations) {
        this.operations = operations;
    }

    public JsonNode getYulAst() {
        return yulAst;
    }

    public void setYulAst(JsonNode yulAst) {
        this.yulAst = yulAst;
    }

    public String getEvmVersion() {
        return evmVersion;
    }

    public void setEvmVersion(String evmVersion) {
        this.evmVersion = evmVersion;
    }

    /** Assembly flags such as {@code memory-safe} (0.8.13+). */
    public List<String> getFlags() {
        return flags;
    }

    public void setFlags(List<String> flags) {
        this.flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public JsonNode getExternalReferences() {
        return externalReferences;
    }

    public void setExternalReferences(JsonNode externalReferences) {
        this.externalReferences = externalReferences;
    }
}
