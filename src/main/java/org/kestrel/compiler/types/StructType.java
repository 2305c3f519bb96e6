package org.kestrel.compiler.types;

/**
 * A container type. Every file is one; its members are the file's declarations.
 * Compared by identity.
 */
public final class StructType implements Type {

    private final String name;
    private final Namespace namespace;

    public StructType(String name, Namespace namespace) {
        this.name = name;
        this.namespace = namespace;
    }

    public String name() {
        return name;
    }

    public Namespace namespace() {
        return namespace;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.STRUCT;
    }

    @Override
    public String toString() {
        return name;
    }
}
