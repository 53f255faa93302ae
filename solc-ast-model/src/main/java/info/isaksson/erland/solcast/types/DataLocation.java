package info.isaksson.erland.solcast.types;

/** Data location qualifier found in a type string. */
public enum DataLocation {
    NONE,
    STORAGE,
    MEMORY,
    CALLDATA,
    TRANSIENT;

    static DataLocation fromQualifier(String word) {
        switch (word) {
            case "storage": return STORAGE;
            case "memory": return MEMORY;
            case "calldata": return CALLDATA;
            case "transient": return TRANSIENT;
            default: return null;
        }
    }
}
