package info.isaksson.erland.solcast.types;

import java.util.Objects;

/**
 * Type annotation the compiler attached to an expression or declaration: the human-readable
 * type string, the machine type identifier (compact schema only) and the parsed descriptor.
 */
public final class TypeDescriptions {
    public final String typeString;
    public final String typeIdentifier;
    /** Parsed {@link #typeString}; {@code null} when the compiler emitted no type string. */
    public final TypeDescriptor descriptor;

    public TypeDescriptions(String typeString, String typeIdentifier, TypeDescriptor descriptor) {
        this.typeString = typeString;
        this.typeIdentifier = typeIdentifier;
        this.descriptor = descriptor;
    }

    /** Parses the type string eagerly; fails with the parser's error on malformed input. */
    public static TypeDescriptions parse(String typeString, String typeIdentifier) {
        TypeDescriptor d = typeString == null ? null : TypeStringParser.parse(typeString);
        return new TypeDescriptions(typeString, typeIdentifier, d);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeDescriptions)) return false;
        TypeDescriptions that = (TypeDescriptions) o;
        return Objects.equals(typeString, that.typeString) &&
                Objects.equals(typeIdentifier, that.typeIdentifier) &&
                Objects.equals(descriptor, that.descriptor);
    }

    @Override public int hashCode() {
        return Objects.hash(typeString, typeIdentifier, descriptor);
    }

    @Override public String toString() {
        return typeString == null ? "<untyped>" : typeString;
    }
}
