package org.kestrel.compiler.types;

/**
 * Types without parameters.
 */
public enum SimpleType implements Type {
    BOOL(TypeKind.BOOL, "bool"),
    VOID(TypeKind.VOID, "void"),
    TYPE(TypeKind.TYPE, "type"),
    NO_RETURN(TypeKind.NO_RETURN, "noreturn"),
    COMPTIME_INT(TypeKind.COMPTIME_INT, "comptime_int"),
    COMPTIME_FLOAT(TypeKind.COMPTIME_FLOAT, "comptime_float"),
    UNDEFINED(TypeKind.UNDEFINED, "@Type(.Undefined)"),
    NULL(TypeKind.NULL, "@Type(.Null)"),
    ENUM_LITERAL(TypeKind.ENUM_LITERAL, "@Type(.EnumLiteral)"),
    /** The error set containing every error. */
    ANYERROR(TypeKind.ERROR_SET, "anyerror"),
    /** Placeholder parameter type for arguments past the fixed parameters of a variadic function. */
    VAR_ARGS_PARAM(TypeKind.VAR_ARGS_PARAM, "(var args param)");

    private final TypeKind kind;
    private final String displayName;

    SimpleType(TypeKind kind, String displayName) {
        this.kind = kind;
        this.displayName = displayName;
    }

    @Override
    public TypeKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
