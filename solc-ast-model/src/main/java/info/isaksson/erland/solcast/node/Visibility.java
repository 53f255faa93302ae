package info.isaksson.erland.solcast.node;

public enum Visibility {
    PUBLIC("public"),
    INTERNAL("internal"),
    PRIVATE("private"),
    EXTERNAL("external"),
    DEFAULT("default");

    private final String raw;

    Visibility(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static Visibility fromRaw(String raw) {
        for (Visibility v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown Visibility: '" + raw + "'");
    }
}
