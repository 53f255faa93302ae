package info.isaksson.erland.solcast.node;

public enum StorageLocation {
    DEFAULT("default"),
    STORAGE("storage"),
    MEMORY("memory"),
    CALLDATA("calldata"),
    TRANSIENT("transient");

    private final String raw;

    StorageLocation(String raw) {
        this.raw = raw;
    }

    /** Spelling used in raw ASTs and in source. */
    public String raw() {
        return raw;
    }

    public static StorageLocation fromRaw(String raw) {
        for (StorageLocation v : values()) {
            if (v.raw.equals(raw)) return v;
        }
        throw new IllegalArgumentException("Unknown StorageLocation: '" + raw + "'");
    }
}
