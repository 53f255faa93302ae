package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.version.SolcVersion;

/**
 * Version predicate for one piece of syntax: available from {@link #since} (inclusive) until
 * {@link #removedIn} (exclusive). Either bound may be {@code null}.
 */
public final class VersionGate {

    public final String feature;
    public final SolcVersion since;
    public final SolcVersion removedIn;

    private VersionGate(String feature, SolcVersion since, SolcVersion removedIn) {
        if (feature == null) throw new IllegalArgumentException("feature must not be null");
        this.feature = feature;
        this.since = since;
        this.removedIn = removedIn;
    }

    public static VersionGate since(String feature, SolcVersion version) {
        return new VersionGate(feature, version, null);
    }

    public static VersionGate removedIn(String feature, SolcVersion version) {
        return new VersionGate(feature, null, version);
    }

    public boolean allows(SolcVersion target) {
        if (target == null) throw new IllegalArgumentException("target must not be null");
        if (since != null && target.isBefore(since)) return false;
        return removedIn == null || target.isBefore(removedIn);
    }

    /** Human-readable requirement, used in error messages. */
    public String requirement() {
        if (since != null && removedIn != null) return "requires solc >= " + since + " and < " + removedIn;
        if (since != null) return "requires solc >= " + since;
        return "removed in solc " + removedIn;
    }

    @Override
    public String toString() {
        return feature + " (" + requirement() + ")";
    }
}
