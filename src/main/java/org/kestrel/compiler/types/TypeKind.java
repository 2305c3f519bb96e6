package org.kestrel.compiler.types;

/**
 * Coarse classification of a {@link Type}, used wherever analysis dispatches on the kind of a type
 * rather than on its exact shape.
 */
public enum TypeKind {
    INT,
    COMPTIME_INT,
    FLOAT,
    COMPTIME_FLOAT,
    BOOL,
    VOID,
    TYPE,
    NO_RETURN,
    UNDEFINED,
    NULL,
    ENUM_LITERAL,
    ERROR_SET,
    POINTER,
    OPTIONAL,
    ERROR_UNION,
    ARRAY,
    FN,
    STRUCT,
    ENUM,
    UNION,
    VAR_ARGS_PARAM
}
