package info.isaksson.erland.solcast.error;

/** Two nodes were registered under the same identity within one read. */
public class DuplicateIdentityException extends SolcAstException {

    private final long identity;
    private final String existingKind;

    public DuplicateIdentityException(long identity, String nodeKind, String existingKind) {
        this(identity, nodeKind, existingKind, null, null);
    }

    private DuplicateIdentityException(long identity, String nodeKind, String existingKind,
                                       String nodePath, String rawFragment) {
        super("Identity " + identity + " is already registered"
                        + (existingKind == null ? "" : " to a " + existingKind),
                nodeKind, nodePath, rawFragment);
        this.identity = identity;
        this.existingKind = existingKind;
    }

    /** Same failure, located at the raw node that carried the duplicate identity. */
    public DuplicateIdentityException locatedAt(String nodePath, String rawFragment) {
        DuplicateIdentityException located =
                new DuplicateIdentityException(identity, getNodeKind(), existingKind, nodePath, rawFragment);
        located.setStackTrace(getStackTrace());
        return located;
    }

    public long getIdentity() {
        return identity;
    }

    public String getExistingKind() {
        return existingKind;
    }
}
