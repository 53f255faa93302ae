package info.isaksson.erland.solcast.error;

import info.isaksson.erland.solcast.version.SolcVersion;

/** A node cannot be expressed in source for the requested compiler version. */
public class UnsupportedForTargetVersionException extends SolcAstException {

    private final String feature;
    private final SolcVersion targetVersion;

    public UnsupportedForTargetVersionException(String feature, SolcVersion targetVersion, String requirement,
                                                String nodeKind, String nodePath) {
        super(feature + " cannot be written for solc " + targetVersion + " (" + requirement + ")",
                nodeKind, nodePath, null);
        this.feature = feature;
        this.targetVersion = targetVersion;
    }

    public String getFeature() {
        return feature;
    }

    public SolcVersion getTargetVersion() {
        return targetVersion;
    }
}
