package org.kestrel.compiler.types;

/**
 * @param errorSet The error set; an {@link ErrorSetType} or {@link SimpleType#ANYERROR}.
 * @param payload  The payload type.
 */
public record ErrorUnionType(Type errorSet, Type payload) implements Type {

    public ErrorUnionType {
        if (errorSet.kind() != TypeKind.ERROR_SET) {
            throw new IllegalArgumentException("not an error set: " + errorSet);
        }
    }

    @Override
    public TypeKind kind() {
        return TypeKind.ERROR_UNION;
    }

    @Override
    public String toString() {
        return errorSet + "!" + payload;
    }
}
