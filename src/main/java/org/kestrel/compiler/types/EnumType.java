package org.kestrel.compiler.types;

import java.util.List;

/**
 * @param name   The type name.
 * @param fields The tag names in declaration order.
 */
public record EnumType(String name, List<String> fields) implements Type {

    public EnumType {
        fields = List.copyOf(fields);
    }

    @Override
    public TypeKind kind() {
        return TypeKind.ENUM;
    }

    @Override
    public String toString() {
        return name;
    }
}
