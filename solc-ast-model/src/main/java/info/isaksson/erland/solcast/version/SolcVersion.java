package info.isaksson.erland.solcast.version;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A totally ordered solc release number ({@code major.minor.patch}).
 *
 * <p>Parsing accepts the spellings the compiler and its wrappers emit, e.g. {@code 0.8.19},
 * {@code v0.4.24}, {@code 0.8.19+commit.7dd6d404} and
 * {@code 0.5.0-nightly.2018.10.9+commit.0ce4a7ce.Linux.g++}; build metadata and prerelease tags
 * are ignored for ordering.</p>
 */
public final class SolcVersion implements Comparable<SolcVersion> {

    private static final Pattern VERSION = Pattern.compile("^\\s*v?(\\d+)\\.(\\d+)(?:\\.(\\d+))?.*$");

    public static final SolcVersion V0_4_11 = of(0, 4, 11);
    public static final SolcVersion V0_4_17 = of(0, 4, 17);
    public static final SolcVersion V0_4_21 = of(0, 4, 21);
    public static final SolcVersion V0_4_22 = of(0, 4, 22);
    public static final SolcVersion V0_5_0 = of(0, 5, 0);
    public static final SolcVersion V0_6_0 = of(0, 6, 0);
    public static final SolcVersion V0_6_2 = of(0, 6, 2);
    public static final SolcVersion V0_6_5 = of(0, 6, 5);
    public static final SolcVersion V0_7_0 = of(0, 7, 0);
    public static final SolcVersion V0_8_0 = of(0, 8, 0);
    public static final SolcVersion V0_8_4 = of(0, 8, 4);
    public static final SolcVersion V0_8_8 = of(0, 8, 8);
    public static final SolcVersion V0_8_13 = of(0, 8, 13);
    public static final SolcVersion V0_8_18 = of(0, 8, 18);

    /** Used when a caller does not name a target version. */
    public static final SolcVersion LATEST = of(0, 8, 28);

    public final int major;
    public final int minor;
    public final int patch;

    private SolcVersion(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must not be negative");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    public static SolcVersion of(int major, int minor, int patch) {
        return new SolcVersion(major, minor, patch);
    }

    public static SolcVersion parse(String text) {
        if (text == null) throw new IllegalArgumentException("version text is null");
        Matcher m = VERSION.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a solc version: '" + text + "'");
        }
        int patch = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        return new SolcVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), patch);
    }

    public boolean isAtLeast(SolcVersion other) {
        return compareTo(other) >= 0;
    }

    public boolean isBefore(SolcVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(SolcVersion o) {
        if (major != o.major) return Integer.compare(major, o.major);
        if (minor != o.minor) return Integer.compare(minor, o.minor);
        return Integer.compare(patch, o.patch);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SolcVersion)) return false;
        SolcVersion that = (SolcVersion) o;
        return major == that.major && minor == that.minor && patch == that.patch;
    }

    @Override public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override public String toString() {
        return major + "." + minor + "." + patch;
    }
}
