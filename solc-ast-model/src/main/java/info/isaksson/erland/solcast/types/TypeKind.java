package info.isaksson.erland.solcast.types;

/** Discriminant of a {@link TypeDescriptor}. */
public enum TypeKind {
    /** Built-in value type: {@code uint256}, {@code bool}, {@code address payable}, {@code bytes}, ... */
    ELEMENTARY,
    /** Magic globals: {@code msg}, {@code block}, {@code tx}, {@code abi}. */
    MAGIC,
    /** Any other bare (possibly dotted) name, e.g. user-defined value types {@code Lib.Price}. */
    NAMED,
    ARRAY,
    MAPPING,
    FUNCTION,
    MODIFIER,
    TUPLE,
    /** An empty tuple slot, as in {@code tuple(,uint256)}. */
    EMPTY,
    /** {@code type(T)}: the type of a type expression. */
    TYPE,
    CONTRACT,
    LIBRARY,
    STRUCT,
    ENUM,
    /** {@code module "path.sol"}: the type of an import alias. */
    MODULE,
    INT_CONST,
    RATIONAL_CONST,
    LITERAL_STRING,
    /** Unparsed text kept when malformed type strings are tolerated. */
    OPAQUE
}
