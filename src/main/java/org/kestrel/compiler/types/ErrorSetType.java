package org.kestrel.compiler.types;

import java.util.List;
import java.util.TreeSet;

/**
 * A finite error set. Two sets with the same names are the same type.
 *
 * @param names The error names, sorted and free of duplicates.
 */
public record ErrorSetType(List<String> names) implements Type {

    public ErrorSetType {
        names = List.copyOf(new TreeSet<>(names));
    }

    /**
     * @param name The single member.
     * @return The error set containing exactly {@code name}.
     */
    public static ErrorSetType single(String name) {
        return new ErrorSetType(List.of(name));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    @Override
    public TypeKind kind() {
        return TypeKind.ERROR_SET;
    }

    @Override
    public String toString() {
        return "error{" + String.join(",", names) + "}";
    }
}
