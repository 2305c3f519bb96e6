package org.kestrel.compiler.frontend.untyped;

import org.kestrel.compiler.types.BoolValue;
import org.kestrel.compiler.types.IntValue;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.SimpleValue;
import org.kestrel.compiler.types.TypedValue;
import org.kestrel.compiler.types.Types;

/**
 * Operand references of the untyped stream.
 * <p>
 * A ref is an {@code int}. Values below {@link #BUILTIN_COUNT} name builtin typed constants,
 * the next {@code paramCount} values name the parameters of the function body, and every
 * value after that names the instruction with index {@code ref - BUILTIN_COUNT - paramCount}.
 */
public final class Ref {

    /** No operand. */
    public static final int NONE = 0;
    public static final int U8_TYPE = 1;
    public static final int I8_TYPE = 2;
    public static final int U16_TYPE = 3;
    public static final int I16_TYPE = 4;
    public static final int U32_TYPE = 5;
    public static final int I32_TYPE = 6;
    public static final int U64_TYPE = 7;
    public static final int I64_TYPE = 8;
    public static final int USIZE_TYPE = 9;
    public static final int ISIZE_TYPE = 10;
    public static final int F16_TYPE = 11;
    public static final int F32_TYPE = 12;
    public static final int F64_TYPE = 13;
    public static final int F128_TYPE = 14;
    public static final int BOOL_TYPE = 15;
    public static final int VOID_TYPE = 16;
    public static final int TYPE_TYPE = 17;
    public static final int ANYERROR_TYPE = 18;
    public static final int NORETURN_TYPE = 19;
    public static final int COMPTIME_INT_TYPE = 20;
    public static final int COMPTIME_FLOAT_TYPE = 21;
    public static final int ENUM_LITERAL_TYPE = 22;
    public static final int UNDEF = 23;
    public static final int ZERO = 24;
    public static final int ONE = 25;
    public static final int VOID_VALUE = 26;
    public static final int UNREACHABLE_VALUE = 27;
    public static final int NULL_VALUE = 28;
    public static final int BOOL_TRUE = 29;
    public static final int BOOL_FALSE = 30;

    /** Number of builtin refs, {@link #NONE} included. */
    public static final int BUILTIN_COUNT = 31;

    private static final TypedValue[] BUILTINS = new TypedValue[BUILTIN_COUNT];

    static {
        BUILTINS[U8_TYPE] = TypedValue.ofType(Types.U8);
        BUILTINS[I8_TYPE] = TypedValue.ofType(Types.I8);
        BUILTINS[U16_TYPE] = TypedValue.ofType(Types.U16);
        BUILTINS[I16_TYPE] = TypedValue.ofType(Types.I16);
        BUILTINS[U32_TYPE] = TypedValue.ofType(Types.U32);
        BUILTINS[I32_TYPE] = TypedValue.ofType(Types.I32);
        BUILTINS[U64_TYPE] = TypedValue.ofType(Types.U64);
        BUILTINS[I64_TYPE] = TypedValue.ofType(Types.I64);
        BUILTINS[USIZE_TYPE] = TypedValue.ofType(Types.USIZE);
        BUILTINS[ISIZE_TYPE] = TypedValue.ofType(Types.ISIZE);
        BUILTINS[F16_TYPE] = TypedValue.ofType(Types.F16);
        BUILTINS[F32_TYPE] = TypedValue.ofType(Types.F32);
        BUILTINS[F64_TYPE] = TypedValue.ofType(Types.F64);
        BUILTINS[F128_TYPE] = TypedValue.ofType(Types.F128);
        BUILTINS[BOOL_TYPE] = TypedValue.ofType(SimpleType.BOOL);
        BUILTINS[VOID_TYPE] = TypedValue.ofType(SimpleType.VOID);
        BUILTINS[TYPE_TYPE] = TypedValue.ofType(SimpleType.TYPE);
        BUILTINS[ANYERROR_TYPE] = TypedValue.ofType(SimpleType.ANYERROR);
        BUILTINS[NORETURN_TYPE] = TypedValue.ofType(SimpleType.NO_RETURN);
        BUILTINS[COMPTIME_INT_TYPE] = TypedValue.ofType(SimpleType.COMPTIME_INT);
        BUILTINS[COMPTIME_FLOAT_TYPE] = TypedValue.ofType(SimpleType.COMPTIME_FLOAT);
        BUILTINS[ENUM_LITERAL_TYPE] = TypedValue.ofType(SimpleType.ENUM_LITERAL);
        BUILTINS[UNDEF] = new TypedValue(SimpleType.UNDEFINED, SimpleValue.UNDEF);
        BUILTINS[ZERO] = new TypedValue(SimpleType.COMPTIME_INT, IntValue.ZERO);
        BUILTINS[ONE] = new TypedValue(SimpleType.COMPTIME_INT, IntValue.ONE);
        BUILTINS[VOID_VALUE] = new TypedValue(SimpleType.VOID, SimpleValue.VOID);
        BUILTINS[UNREACHABLE_VALUE] = new TypedValue(SimpleType.NO_RETURN, SimpleValue.UNREACHABLE);
        BUILTINS[NULL_VALUE] = new TypedValue(SimpleType.NULL, SimpleValue.NULL);
        BUILTINS[BOOL_TRUE] = new TypedValue(SimpleType.BOOL, BoolValue.TRUE);
        BUILTINS[BOOL_FALSE] = new TypedValue(SimpleType.BOOL, BoolValue.FALSE);
    }

    private Ref() {}

    public static boolean isBuiltin(int ref) {
        return ref > NONE && ref < BUILTIN_COUNT;
    }

    /**
     * @param ref A builtin ref other than {@link #NONE}.
     * @return The typed constant the ref stands for.
     */
    public static TypedValue builtin(int ref) {
        if (!isBuiltin(ref)) {
            throw new IllegalArgumentException("not a builtin ref: " + ref);
        }
        return BUILTINS[ref];
    }
}
