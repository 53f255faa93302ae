package info.isaksson.erland.solcast.node;

/** Coarse grouping of node kinds. */
public enum NodeCategory {
    DECLARATION,
    STATEMENT,
    EXPRESSION,
    TYPE_NAME,
    /** Directives and structural helpers: source units, pragmas, parameter lists, specifiers. */
    META
}
