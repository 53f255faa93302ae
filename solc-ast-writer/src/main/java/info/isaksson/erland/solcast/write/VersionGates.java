package info.isaksson.erland.solcast.write;

import info.isaksson.erland.solcast.version.SolcVersion;

/**
 * Catalogue of the syntax boundaries the standard rules check.
 *
 * <p>Rules consult these through {@link RenderContext#supports(VersionGate)} when an older
 * spelling exists and through {@link RenderContext#require(VersionGate, info.isaksson.erland.solcast.node.AstNode)}
 * when it does not.</p>
 */
public final class VersionGates {

    private VersionGates() {}

    // Spelling choices with a fallback below the boundary
    public static final VersionGate VIEW_PURE_KEYWORDS = VersionGate.since("view/pure mutability", SolcVersion.V0_4_17);
    public static final VersionGate EMIT = VersionGate.since("emit statement", SolcVersion.V0_4_21);
    public static final VersionGate CONSTRUCTOR_KEYWORD = VersionGate.since("constructor keyword", SolcVersion.V0_4_22);
    public static final VersionGate EXPLICIT_VISIBILITY = VersionGate.since("mandatory function visibility", SolcVersion.V0_5_0);
    public static final VersionGate CALLDATA = VersionGate.since("calldata location", SolcVersion.V0_5_0);
    public static final VersionGate ADDRESS_PAYABLE = VersionGate.since("address payable", SolcVersion.V0_5_0);
    public static final VersionGate FALLBACK_KEYWORD = VersionGate.since("fallback keyword", SolcVersion.V0_6_0);
    public static final VersionGate ABSTRACT = VersionGate.since("abstract contracts", SolcVersion.V0_6_0);
    public static final VersionGate VIRTUAL = VersionGate.since("virtual functions", SolcVersion.V0_6_0);
    public static final VersionGate OVERRIDE = VersionGate.since("override specifier", SolcVersion.V0_6_0);
    public static final VersionGate PAYABLE_CONVERSION = VersionGate.since("payable(...) conversion", SolcVersion.V0_6_0);
    public static final VersionGate CALL_OPTIONS = VersionGate.since("call options", SolcVersion.V0_6_2);
    public static final VersionGate CONSTRUCTOR_VISIBILITY = VersionGate.removedIn("constructor visibility", SolcVersion.V0_7_0);
    public static final VersionGate NAMED_MAPPING_KEYS = VersionGate.since("named mapping parameters", SolcVersion.V0_8_18);

    // Constructs with no older spelling
    public static final VersionGate THROW = VersionGate.removedIn("throw statement", SolcVersion.V0_5_0);
    public static final VersionGate VAR = VersionGate.removedIn("var declaration", SolcVersion.V0_5_0);
    public static final VersionGate RECEIVE = VersionGate.since("receive function", SolcVersion.V0_6_0);
    public static final VersionGate TRY_CATCH = VersionGate.since("try/catch", SolcVersion.V0_6_0);
    public static final VersionGate INDEX_RANGE = VersionGate.since("array slices", SolcVersion.V0_6_0);
    public static final VersionGate CREATE2_SALT = VersionGate.since("salt call option", SolcVersion.V0_6_2);
    public static final VersionGate IMMUTABLE = VersionGate.since("immutable variables", SolcVersion.V0_6_5);
    public static final VersionGate FREE_FUNCTIONS = VersionGate.since("free functions", SolcVersion.of(0, 7, 1));
    public static final VersionGate UNICODE_LITERALS = VersionGate.since("unicode string literals", SolcVersion.V0_7_0);
    public static final VersionGate UNCHECKED = VersionGate.since("unchecked blocks", SolcVersion.V0_8_0);
    public static final VersionGate CUSTOM_ERRORS = VersionGate.since("custom errors", SolcVersion.V0_8_4);
    public static final VersionGate USER_DEFINED_VALUE_TYPES = VersionGate.since("user-defined value types", SolcVersion.V0_8_8);
    public static final VersionGate FILE_LEVEL_USING_FOR = VersionGate.since("file-level using for", SolcVersion.V0_8_13);
    public static final VersionGate USING_FOR_FUNCTION_LIST = VersionGate.since("using {f} for", SolcVersion.V0_8_13);
    public static final VersionGate GLOBAL_USING_FOR = VersionGate.since("global using for", SolcVersion.V0_8_13);
    public static final VersionGate USER_DEFINED_OPERATORS = VersionGate.since("user-defined operators", SolcVersion.of(0, 8, 19));
    public static final VersionGate TRANSIENT_STORAGE = VersionGate.since("transient storage", SolcVersion.of(0, 8, 27));
}
