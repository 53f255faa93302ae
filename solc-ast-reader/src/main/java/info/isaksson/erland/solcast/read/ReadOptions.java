package info.isaksson.erland.solcast.read;

import info.isaksson.erland.solcast.postprocess.PostprocessorPipeline;
import info.isaksson.erland.solcast.version.SolcVersion;

/** Options for {@link AstReader}. */
public final class ReadOptions {

    /** Keep unparseable type strings as opaque descriptors instead of failing the read. */
    public boolean tolerateMalformedTypeStrings = false;

    /** Version to assume when the compiler output does not name one. {@code null} means unknown. */
    public SolcVersion assumedVersion = null;

    /** Postprocessing passes; {@code null} means {@link PostprocessorPipeline#standard()}. */
    public PostprocessorPipeline pipeline = null;

    public static ReadOptions defaults() {
        return new ReadOptions();
    }

    public ReadOptions copy() {
        ReadOptions o = new ReadOptions();
        o.tolerateMalformedTypeStrings = tolerateMalformedTypeStrings;
        o.assumedVersion = assumedVersion;
        o.pipeline = pipeline;
        return o;
    }
}
