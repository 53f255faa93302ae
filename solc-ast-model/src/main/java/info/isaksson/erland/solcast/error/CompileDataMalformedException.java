package info.isaksson.erland.solcast.error;

/** The compiler output misses structure required before any node can be read. */
public class CompileDataMalformedException extends SolcAstException {

    public CompileDataMalformedException(String message, String nodePath, String rawFragment) {
        super(message, null, nodePath, rawFragment);
    }

    public CompileDataMalformedException(String message, Throwable cause) {
        super(message, null, null, null, cause);
    }
}
