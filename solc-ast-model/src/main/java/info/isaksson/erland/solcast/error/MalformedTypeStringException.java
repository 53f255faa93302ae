package info.isaksson.erland.solcast.error;

/** A compiler type string could not be parsed. */
public class MalformedTypeStringException extends SolcAstException {

    private final String typeString;
    private final int position;
    private final String reason;

    public MalformedTypeStringException(String typeString, int position, String reason) {
        this(typeString, position, reason, null, null, null);
    }

    private MalformedTypeStringException(String typeString, int position, String reason,
                                         String nodeKind, String nodePath, String rawFragment) {
        super("Malformed type string '" + typeString + "' at position " + position
                        + " near '" + offending(typeString, position) + "': " + reason,
                nodeKind, nodePath, rawFragment);
        this.typeString = typeString;
        this.position = position;
        this.reason = reason;
    }

    /** Same failure, located at the node whose annotation carried the type string. */
    public MalformedTypeStringException locatedAt(String nodeKind, String nodePath, String rawFragment) {
        MalformedTypeStringException located =
                new MalformedTypeStringException(typeString, position, reason, nodeKind, nodePath, rawFragment);
        located.setStackTrace(getStackTrace());
        return located;
    }

    public String getTypeString() {
        return typeString;
    }

    public int getPosition() {
        return position;
    }

    /** The substring starting at the failure position (at most 24 characters). */
    public String getOffendingText() {
        return offending(typeString, position);
    }

    private static String offending(String s, int position) {
        if (s == null) return "";
        int start = Math.max(0, Math.min(position, s.length()));
        int end = Math.min(s.length(), start + 24);
        return s.substring(start, end);
    }
}
