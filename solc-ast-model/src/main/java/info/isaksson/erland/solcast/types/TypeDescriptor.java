package info.isaksson.erland.solcast.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured form of a compiler type string such as
 * {@code mapping(address => uint256[] storage ref)}.
 *
 * <p>Immutable. Which fields are used depends on {@link #kind}:</p>
 * <ul>
 *   <li>{@code name}: the type name for named kinds, the literal text for constant kinds,
 *   the raw text for {@link TypeKind#OPAQUE}</li>
 *   <li>{@code element}: array base, mapping key, inner type of {@code type(T)}</li>
 *   <li>{@code value}: mapping value</li>
 *   <li>{@code parameters}/{@code returns}: function and modifier signatures, tuple components</li>
 *   <li>{@code modifiers}: function attributes ({@code pure}, {@code external}, ...),
 *   or {@code super} for contracts</li>
 *   <li>{@code qualifiers}: trailing words in source order ({@code storage}, {@code ref}, ...),
 *   unknown words included</li>
 * </ul>
 */
public final class TypeDescriptor {
    public final TypeKind kind;
    public final String name;
    public final TypeDescriptor element;
    public final TypeDescriptor value;
    /** Static array length, {@code null} for dynamic arrays. */
    public final String arrayLength;
    /** Optional names of a mapping's key and value (0.8.18+). */
    public final String keyName;
    public final String valueName;
    public final List<TypeDescriptor> parameters;
    public final List<TypeDescriptor> returns;
    public final List<String> modifiers;
    public final List<String> qualifiers;

    TypeDescriptor(TypeKind kind, String name, TypeDescriptor element, TypeDescriptor value, String arrayLength,
                   String keyName, String valueName, List<TypeDescriptor> parameters, List<TypeDescriptor> returns,
                   List<String> modifiers, List<String> qualifiers) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.element = element;
        this.value = value;
        this.arrayLength = arrayLength;
        this.keyName = keyName;
        this.valueName = valueName;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returns = returns == null ? List.of() : List.copyOf(returns);
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.qualifiers = qualifiers == null ? List.of() : List.copyOf(qualifiers);
    }

    public static TypeDescriptor named(TypeKind kind, String name) {
        return new TypeDescriptor(kind, name, null, null, null, null, null, null, null, null, null);
    }

    public static TypeDescriptor elementary(String name) {
        return named(TypeKind.ELEMENTARY, name);
    }

    public static TypeDescriptor arrayOf(TypeDescriptor base, String length) {
        return new TypeDescriptor(TypeKind.ARRAY, null, base, null, length, null, null, null, null, null, null);
    }

    public static TypeDescriptor mapping(TypeDescriptor key, String keyName, TypeDescriptor value, String valueName) {
        return new TypeDescriptor(TypeKind.MAPPING, null, key, value, null, keyName, valueName, null, null, null, null);
    }

    public static TypeDescriptor function(List<TypeDescriptor> parameters, List<String> modifiers,
                                          List<TypeDescriptor> returns) {
        return new TypeDescriptor(TypeKind.FUNCTION, null, null, null, null, null, null, parameters, returns, modifiers, null);
    }

    public static TypeDescriptor modifier(List<TypeDescriptor> parameters) {
        return new TypeDescriptor(TypeKind.MODIFIER, null, null, null, null, null, null, parameters, null, null, null);
    }

    public static TypeDescriptor tuple(List<TypeDescriptor> components) {
        return new TypeDescriptor(TypeKind.TUPLE, null, null, null, null, null, null, components, null, null, null);
    }

    public static TypeDescriptor empty() {
        return named(TypeKind.EMPTY, null);
    }

    public static TypeDescriptor typeOf(TypeDescriptor inner) {
        return new TypeDescriptor(TypeKind.TYPE, null, inner, null, null, null, null, null, null, null, null);
    }

    public static TypeDescriptor contract(String name, boolean isSuper) {
        return new TypeDescriptor(TypeKind.CONTRACT, name, null, null, null, null, null, null, null,
                isSuper ? List.of("super") : null, null);
    }

    /** Unparsed fallback for tolerated malformed type strings. */
    public static TypeDescriptor opaque(String text) {
        return named(TypeKind.OPAQUE, text);
    }

    /** Copy of this descriptor with an extra trailing qualifier. */
    public TypeDescriptor withQualifier(String qualifier) {
        List<String> q = new ArrayList<>(qualifiers);
        q.add(qualifier);
        return new TypeDescriptor(kind, name, element, value, arrayLength, keyName, valueName,
                parameters, returns, modifiers, q);
    }

    /** First data location qualifier, or {@link DataLocation#NONE}. */
    public DataLocation getLocation() {
        for (String q : qualifiers) {
            DataLocation loc = DataLocation.fromQualifier(q);
            if (loc != null) return loc;
        }
        return DataLocation.NONE;
    }

    /** True for {@code storage pointer} (as opposed to {@code storage ref}). */
    public boolean isPointer() {
        return qualifiers.contains("pointer");
    }

    public boolean isSuperContract() {
        return kind == TypeKind.CONTRACT && modifiers.contains("super");
    }

    public boolean isPayableAddress() {
        return kind == TypeKind.ELEMENTARY && "address payable".equals(name);
    }

    public boolean isDynamicArray() {
        return kind == TypeKind.ARRAY && arrayLength == null;
    }

    /** Re-serialize in the compiler's spelling; parsing the result yields an equal descriptor. */
    public String toTypeString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb) {
        switch (kind) {
            case ARRAY:
                element.appendTo(sb);
                sb.append('[').append(arrayLength == null ? "" : arrayLength).append(']');
                break;
            case MAPPING:
                sb.append("mapping(");
                element.appendTo(sb);
                if (keyName != null) sb.append(' ').append(keyName);
                sb.append(" => ");
                value.appendTo(sb);
                if (valueName != null) sb.append(' ').append(valueName);
                sb.append(')');
                break;
            case FUNCTION:
                sb.append("function (");
                appendList(sb, parameters);
                sb.append(')');
                for (String m : modifiers) sb.append(' ').append(m);
                if (!returns.isEmpty()) {
                    sb.append(" returns (");
                    appendList(sb, returns);
                    sb.append(')');
                }
                break;
            case MODIFIER:
                sb.append("modifier (");
                appendList(sb, parameters);
                sb.append(')');
                break;
            case TUPLE:
                sb.append("tuple(");
                appendList(sb, parameters);
                sb.append(')');
                break;
            case EMPTY:
                break;
            case TYPE:
                sb.append("type(");
                element.appendTo(sb);
                sb.append(')');
                break;
            case CONTRACT:
                sb.append("contract ");
                if (isSuperContract()) sb.append("super ");
                sb.append(name);
                break;
            case LIBRARY:
                sb.append("library ").append(name);
                break;
            case STRUCT:
                sb.append("struct ").append(name);
                break;
            case ENUM:
                sb.append("enum ").append(name);
                break;
            case MODULE:
                sb.append("module ").append(name);
                break;
            case INT_CONST:
                sb.append("int_const ").append(name);
                break;
            case RATIONAL_CONST:
                sb.append("rational_const ").append(name);
                break;
            case LITERAL_STRING:
                sb.append("literal_string ").append(name);
                break;
            default:
                sb.append(name);
                break;
        }
        for (String q : qualifiers) sb.append(' ').append(q);
    }

    private static void appendList(StringBuilder sb, List<TypeDescriptor> list) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) sb.append(',');
            list.get(i).appendTo(sb);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeDescriptor)) return false;
        TypeDescriptor that = (TypeDescriptor) o;
        return kind == that.kind &&
                Objects.equals(name, that.name) &&
                Objects.equals(element, that.element) &&
                Objects.equals(value, that.value) &&
                Objects.equals(arrayLength, that.arrayLength) &&
                Objects.equals(keyName, that.keyName) &&
                Objects.equals(valueName, that.valueName) &&
                Objects.equals(parameters, that.parameters) &&
                Objects.equals(returns, that.returns) &&
                Objects.equals(modifiers, that.modifiers) &&
                Objects.equals(qualifiers, that.qualifiers);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, element, value, arrayLength, keyName, valueName,
                parameters, returns, modifiers, qualifiers);
    }

    @Override public String toString() {
        return toTypeString();
    }
}
