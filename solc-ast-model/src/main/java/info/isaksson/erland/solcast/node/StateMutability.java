package info.isaksson.erland.solcast.node;

public enum StateMutability {
    PURE("pure"),
    VIEW("view"),
    NONPAYABLE("nonpayable"),
    PAYABLE("payable");

    private final String raw;

    StateMutability(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static StateMutability fromRaw(String raw) {
        for (StateMutability v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown StateMutability: '" + raw + "'");
    }
}
