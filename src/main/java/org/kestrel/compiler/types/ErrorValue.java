package org.kestrel.compiler.types;

/**
 * A single error, identified by its interned name.
 */
public record ErrorValue(String name) implements Value {

    @Override
    public String toString() {
        return "error." + name;
    }
}
