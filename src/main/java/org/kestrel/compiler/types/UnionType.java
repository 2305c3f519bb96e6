package org.kestrel.compiler.types;

/**
 * @param name The type name.
 */
public record UnionType(String name) implements Type {

    @Override
    public TypeKind kind() {
        return TypeKind.UNION;
    }

    @Override
    public String toString() {
        return name;
    }
}
