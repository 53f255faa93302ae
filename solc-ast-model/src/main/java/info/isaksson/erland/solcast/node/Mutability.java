package info.isaksson.erland.solcast.node;

/** Variable mutability; the compiler reports it explicitly from 0.6.5 on. */
public enum Mutability {
    MUTABLE("mutable"),
    IMMUTABLE("immutable"),
    CONSTANT("constant");

    private final String raw;

    Mutability(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static Mutability fromRaw(String raw) {
        for (Mutability v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown Mutability: '" + raw + "'");
    }
}
