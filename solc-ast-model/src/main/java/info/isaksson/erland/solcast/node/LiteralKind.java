package info.isaksson.erland.solcast.node;

/** Literal token kind. */
public enum LiteralKind {
    NUMBER("number"),
    STRING("string"),
    BOOL("bool"),
    HEX_STRING("hexString"),
    UNICODE_STRING("unicodeString");

    private final String raw;

    LiteralKind(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static LiteralKind fromRaw(String raw) {
        for (LiteralKind v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown LiteralKind: '" + raw + "'");
    }
}
