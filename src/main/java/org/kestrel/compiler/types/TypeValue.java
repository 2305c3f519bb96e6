package org.kestrel.compiler.types;

/**
 * A type used as a value; the instruction holding it has type {@code type}.
 */
public record TypeValue(Type type) implements Value {

    @Override
    public String toString() {
        return type.toString();
    }
}
