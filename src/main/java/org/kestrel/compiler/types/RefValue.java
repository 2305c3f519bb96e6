package org.kestrel.compiler.types;

/**
 * A compile-time-known pointer to an anonymous compile-time value.
 */
public record RefValue(Value pointee) implements Value {

    @Override
    public String toString() {
        return "&" + pointee;
    }
}
