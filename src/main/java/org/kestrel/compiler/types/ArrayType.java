package org.kestrel.compiler.types;

/**
 * @param len      The number of elements, not counting the sentinel.
 * @param elem     The element type.
 * @param sentinel The terminating value, or {@code null}.
 */
public record ArrayType(long len, Type elem, Value sentinel) implements Type {

    @Override
    public TypeKind kind() {
        return TypeKind.ARRAY;
    }

    @Override
    public String toString() {
        return sentinel == null ? "[" + len + "]" + elem : "[" + len + ":" + sentinel + "]" + elem;
    }
}
