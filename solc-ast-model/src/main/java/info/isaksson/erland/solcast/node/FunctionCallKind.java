package info.isaksson.erland.solcast.node;

public enum FunctionCallKind {
    FUNCTION_CALL("functionCall"),
    TYPE_CONVERSION("typeConversion"),
    STRUCT_CONSTRUCTOR_CALL("structConstructorCall");

    private final String raw;

    FunctionCallKind(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static FunctionCallKind fromRaw(String raw) {
        for (FunctionCallKind v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown FunctionCallKind: '" + raw + "'");
    }
}
