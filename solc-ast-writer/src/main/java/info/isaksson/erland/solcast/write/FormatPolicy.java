package info.isaksson.erland.solcast.write;

/**
 * Whitespace settings for {@link SourceWriter}. Governs layout only; two policies never change
 * what the emitted source means.
 */
public final class FormatPolicy {

    /** Spaces per indentation level; ignored when {@link #useTabs} is set. */
    public final int indentWidth;
    public final boolean useTabs;

    /** When true, members are not separated by blank lines. */
    public final boolean compact;

    /** Terminate the text of a whole source unit with a newline. */
    public final boolean finalNewline;

    public FormatPolicy(int indentWidth, boolean useTabs, boolean compact, boolean finalNewline) {
        if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must not be negative");
        this.indentWidth = indentWidth;
        this.useTabs = useTabs;
        this.compact = compact;
        this.finalNewline = finalNewline;
    }

    public static FormatPolicy defaults() {
        return new FormatPolicy(4, false, false, true);
    }

    public FormatPolicy withIndentWidth(int width) {
        return new FormatPolicy(width, useTabs, compact, finalNewline);
    }

    public FormatPolicy withTabs(boolean tabs) {
        return new FormatPolicy(indentWidth, tabs, compact, finalNewline);
    }

    public FormatPolicy withCompact(boolean compactLayout) {
        return new FormatPolicy(indentWidth, useTabs, compactLayout, finalNewline);
    }

    public FormatPolicy withFinalNewline(boolean newline) {
        return new FormatPolicy(indentWidth, useTabs, compact, newline);
    }

    /** Leading whitespace for the given nesting depth. */
    public String indent(int depth) {
        if (depth <= 0) return "";
        return useTabs ? "\t".repeat(depth) : " ".repeat(indentWidth * depth);
    }

    @Override
    public String toString() {
        return "FormatPolicy{" +
                "indentWidth=" + indentWidth +
                ", useTabs=" + useTabs +
                ", compact=" + compact +
                ", finalNewline=" + finalNewline +
                '}';
    }
}
