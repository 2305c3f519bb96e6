package org.kestrel.compiler.types;

/**
 * @param child The payload type.
 */
public record OptionalType(Type child) implements Type {

    @Override
    public TypeKind kind() {
        return TypeKind.OPTIONAL;
    }

    @Override
    public String toString() {
        return "?" + child;
    }
}
