package info.isaksson.erland.solcast.core;

import info.isaksson.erland.solcast.postprocess.PostprocessorPipeline;
import info.isaksson.erland.solcast.read.ReadOptions;
import info.isaksson.erland.solcast.version.SolcVersion;
import info.isaksson.erland.solcast.write.FormatPolicy;
import info.isaksson.erland.solcast.write.WriterMapping;

/**
 * Options for reading compiler output and regenerating source text.
 *
 * <p>Combines the reader and writer settings in one structured form.</p>
 */
public final class SolcAstOptions {
    /**
     * Version the regenerated text must compile under.
     *
     * <p>When {@code null} the compiler version found in the output is used, and
     * {@link SolcVersion#LATEST} when the output names none.</p>
     */
    public SolcVersion targetVersion = null;

    public FormatPolicy formatPolicy = FormatPolicy.defaults();

    /** Node-kind to rule table; replace single rules with {@link WriterMapping#withRule}. */
    public WriterMapping mapping = WriterMapping.standard();

    /** Keep unparseable type strings as opaque descriptors instead of failing the read. */
    public boolean tolerateMalformedTypeStrings = false;

    /** Compiler version to assume when the output does not report one. */
    public SolcVersion assumedVersion = null;

    /** Postprocessors to run after reading; {@code null} selects the standard pipeline. */
    public PostprocessorPipeline pipeline = null;

    ReadOptions toReadOptions() {
        ReadOptions read = ReadOptions.defaults();
        read.tolerateMalformedTypeStrings = tolerateMalformedTypeStrings;
        read.assumedVersion = assumedVersion;
        read.pipeline = pipeline;
        return read;
    }
}
