package info.isaksson.erland.solcast.read;

/** The two raw AST schemas solc emits. */
public enum SchemaVariant {
    /** {@code {id, name, src, attributes, children}} nodes ({@code legacyAST}, {@code --ast-json} before 0.8). */
    LEGACY,
    /** {@code {id, nodeType, src, ...}} nodes with named child fields ({@code ast}, compact JSON). */
    MODERN;

    public String label() {
        return this == LEGACY ? "legacy" : "compact";
    }
}
