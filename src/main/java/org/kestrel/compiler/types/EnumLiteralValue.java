package org.kestrel.compiler.types;

public record EnumLiteralValue(String name) implements Value {

    @Override
    public String toString() {
        return "." + name;
    }
}
