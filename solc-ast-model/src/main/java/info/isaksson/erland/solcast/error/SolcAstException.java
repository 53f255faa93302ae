package info.isaksson.erland.solcast.error;

/**
 * Root of the structured error taxonomy.
 *
 * <p>Every error carries the node kind it concerns, the path of that node from its tree root
 * (a JSON-pointer-like string while reading) and, where available, a truncated fragment of the
 * originating raw JSON. Any of these may be {@code null} when not applicable.</p>
 */
public class SolcAstException extends RuntimeException {

    static final int MAX_FRAGMENT_CHARS = 240;

    private final String nodeKind;
    private final String nodePath;
    private final String rawFragment;

    public SolcAstException(String message, String nodeKind, String nodePath, String rawFragment) {
        this(message, nodeKind, nodePath, rawFragment, null);
    }

    public SolcAstException(String message, String nodeKind, String nodePath, String rawFragment, Throwable cause) {
        super(message, cause);
        this.nodeKind = nodeKind;
        this.nodePath = nodePath;
        this.rawFragment = truncate(rawFragment);
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public String getNodePath() {
        return nodePath;
    }

    public String getRawFragment() {
        return rawFragment;
    }

    /** Message plus location details, for diagnostics. */
    public String describe() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(": ").append(getMessage());
        if (nodeKind != null) sb.append(" [kind=").append(nodeKind).append(']');
        if (nodePath != null) sb.append(" [path=").append(nodePath).append(']');
        if (rawFragment != null) sb.append(" [raw=").append(rawFragment).append(']');
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_FRAGMENT_CHARS) return s;
        return s.substring(0, MAX_FRAGMENT_CHARS) + "…(truncated)";
    }
}
