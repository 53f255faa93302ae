package info.isaksson.erland.solcast.node;

/** Function flavour; the compiler reports it explicitly from 0.5.0 on. */
public enum FunctionKind {
    FUNCTION("function"),
    CONSTRUCTOR("constructor"),
    FALLBACK("fallback"),
    RECEIVE("receive"),
    FREE_FUNCTION("freeFunction");

    private final String raw;

    FunctionKind(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static FunctionKind fromRaw(String raw) {
        for (FunctionKind v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown FunctionKind: '" + raw + "'");
    }
}
