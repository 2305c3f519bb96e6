package org.kestrel.compiler.types;

/**
 * A type descriptor of the typed IR. The set of variants is closed.
 * <p>
 * Structural types are records and compare by value; container types compare by identity.
 * {@link #toString()} renders the type the way diagnostics print it.
 */
public sealed interface Type permits SimpleType, IntType, FloatType, PointerType, OptionalType,
        ErrorUnionType, ErrorSetType, ArrayType, FnType, StructType, EnumType, UnionType {

    /**
     * @return The coarse kind of this type.
     */
    TypeKind kind();

    default boolean isNoReturn() {
        return kind() == TypeKind.NO_RETURN;
    }
}
