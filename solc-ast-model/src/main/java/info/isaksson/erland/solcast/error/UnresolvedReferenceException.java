package info.isaksson.erland.solcast.error;

/** A reference names an identity that is not registered in the context. */
public class UnresolvedReferenceException extends SolcAstException {

    private final long identity;

    public UnresolvedReferenceException(long identity, String detail) {
        super("Identity " + identity + " is not registered" + (detail == null ? "" : ": " + detail),
                null, null, null);
        this.identity = identity;
    }

    public long getIdentity() {
        return identity;
    }
}
