package org.kestrel.compiler.types;

public enum Signedness {
    SIGNED,
    UNSIGNED
}
