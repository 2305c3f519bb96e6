package org.kestrel.compiler.types;

/**
 * Values without payload.
 */
public enum SimpleValue implements Value {
    VOID("{}"),
    UNDEF("undefined"),
    NULL("null"),
    /** Value of instructions of type {@code noreturn}. */
    UNREACHABLE("unreachable");

    private final String text;

    SimpleValue(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return text;
    }
}
