package info.isaksson.erland.solcast.node;

import java.util.Objects;

/**
 * Byte range of a node in its originating source, as encoded by the compiler's
 * {@code src} attribute ({@code offset:length:sourceIndex}).
 */
public final class SourceRange {
    public final int offset;
    public final int length;
    /** Index of the source unit in the compiler's source list; -1 when unknown. */
    public final int sourceIndex;

    public SourceRange(int offset, int length, int sourceIndex) {
        this.offset = offset;
        this.length = length;
        this.sourceIndex = sourceIndex;
    }

    /**
     * Parse a {@code src} attribute. Returns {@code null} for {@code null} input and for the
     * compiler's "no location" marker {@code -1:-1:-1}.
     */
    public static SourceRange parse(String src) {
        if (src == null) return null;
        String[] parts = src.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Not a source range: '" + src + "'");
        }
        try {
            int offset = Integer.parseInt(parts[0].trim());
            int length = Integer.parseInt(parts[1].trim());
            int index = parts.length == 3 ? Integer.parseInt(parts[2].trim()) : -1;
            if (offset < 0 && length < 0) return null;
            return new SourceRange(offset, length, index);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a source range: '" + src + "'", e);
        }
    }

    public int end() {
        return offset + length;
    }

    /** The compiler's textual encoding. */
    public String encode() {
        return offset + ":" + length + ":" + sourceIndex;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRange)) return false;
        SourceRange that = (SourceRange) o;
        return offset == that.offset && length == that.length && sourceIndex == that.sourceIndex;
    }

    @Override public int hashCode() {
        return Objects.hash(offset, length, sourceIndex);
    }

    @Override public String toString() {
        return encode();
    }
}
