package info.isaksson.erland.solcast.node;

public enum ContractKind {
    CONTRACT("contract"),
    INTERFACE("interface"),
    LIBRARY("library");

    private final String raw;

    ContractKind(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static ContractKind fromRaw(String raw) {
        for (ContractKind v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown ContractKind: '" + raw + "'");
    }
}
