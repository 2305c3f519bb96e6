package org.kestrel.compiler.types;

/**
 * A type together with its compile-time-known value; the value is {@code null} for runtime-only results.
 *
 * @param type  The type.
 * @param value The value, or {@code null}.
 */
public record TypedValue(Type type, Value value) {

    public static TypedValue ofType(Type type) {
        return new TypedValue(SimpleType.TYPE, new TypeValue(type));
    }
}
