package org.kestrel.compiler.types;

/**
 * A compile-time-known payload of a typed instruction. The set of variants is closed.
 * <p>
 * A value carries no type of its own; the typed instruction holding it does. The same value can
 * therefore stand for a {@code T}, a {@code ?T} or an {@code E!T}.
 */
public sealed interface Value permits SimpleValue, IntValue, FloatValue, BoolValue, TypeValue, ErrorValue,
        EnumLiteralValue, BytesValue, FunctionValue, DeclRefValue, RefValue, ElemPtrValue {

    default boolean isUndef() {
        return this == SimpleValue.UNDEF;
    }

    default boolean isNull() {
        return this == SimpleValue.NULL;
    }
}
