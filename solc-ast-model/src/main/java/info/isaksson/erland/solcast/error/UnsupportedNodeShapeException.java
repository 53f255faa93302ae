package info.isaksson.erland.solcast.error;

/** A processor met a raw node it cannot map onto the model. */
public class UnsupportedNodeShapeException extends SolcAstException {

    private final String schemaVariant;

    public UnsupportedNodeShapeException(String reason, String nodeKind, String schemaVariant,
                                         String nodePath, String rawFragment) {
        this(reason, nodeKind, schemaVariant, nodePath, rawFragment, null);
    }

    public UnsupportedNodeShapeException(String reason, String nodeKind, String schemaVariant,
                                         String nodePath, String rawFragment, Throwable cause) {
        super(reason + " (" + schemaVariant + " schema)", nodeKind, nodePath, rawFragment, cause);
        this.schemaVariant = schemaVariant;
    }

    public String getSchemaVariant() {
        return schemaVariant;
    }
}
