package org.kestrel.compiler.types;

/**
 * Constants and queries over {@link Type}s.
 */
public final class Types {

    public static final IntType U1 = unsigned(1);
    public static final IntType U2 = unsigned(2);
    public static final IntType U8 = unsigned(8);
    public static final IntType I8 = signed(8);
    public static final IntType U16 = unsigned(16);
    public static final IntType I16 = signed(16);
    public static final IntType U32 = unsigned(32);
    public static final IntType I32 = signed(32);
    public static final IntType U64 = unsigned(64);
    public static final IntType I64 = signed(64);
    public static final IntType USIZE = U64;
    public static final IntType ISIZE = I64;

    public static final FloatType F16 = new FloatType(16);
    public static final FloatType F32 = new FloatType(32);
    public static final FloatType F64 = new FloatType(64);
    public static final FloatType F128 = new FloatType(128);

    /** The type of string-like operands: {@code []const u8}. */
    public static final PointerType CONST_SLICE_U8 = new PointerType(PointerType.Size.SLICE, U8, false, false, false, null);

    private Types() {}

    public static IntType signed(int bits) {
        return new IntType(Signedness.SIGNED, bits);
    }

    public static IntType unsigned(int bits) {
        return new IntType(Signedness.UNSIGNED, bits);
    }

    public static IntType intType(boolean signed, int bits) {
        return signed ? signed(bits) : unsigned(bits);
    }

    /**
     * @param elem    The pointee.
     * @param mutable {@code false} for a pointer to const.
     * @param size    The pointer flavour.
     * @return A pointer type without sentinel, volatile or allowzero.
     */
    public static PointerType simplePtrType(Type elem, boolean mutable, PointerType.Size size) {
        return new PointerType(size, elem, mutable, false, false, null);
    }

    /**
     * @param len The number of characters.
     * @return The type of a string literal of that length, {@code [len:0]u8}.
     */
    public static ArrayType stringLiteralType(long len) {
        return new ArrayType(len, U8, IntValue.ZERO);
    }

    public static boolean isInt(Type type) {
        return type.kind() == TypeKind.INT;
    }

    public static boolean isSignedInt(Type type) {
        return type instanceof IntType it && it.isSigned();
    }

    public static boolean isFloat(Type type) {
        return type.kind() == TypeKind.FLOAT;
    }

    /**
     * @return {@code true} for sized and literal integers and floats.
     */
    public static boolean isNumeric(Type type) {
        TypeKind kind = type.kind();
        return kind == TypeKind.INT || kind == TypeKind.COMPTIME_INT
                || kind == TypeKind.FLOAT || kind == TypeKind.COMPTIME_FLOAT;
    }

    public static boolean isIntOrComptimeInt(Type type) {
        return type.kind() == TypeKind.INT || type.kind() == TypeKind.COMPTIME_INT;
    }

    public static boolean isFloatOrComptimeFloat(Type type) {
        return type.kind() == TypeKind.FLOAT || type.kind() == TypeKind.COMPTIME_FLOAT;
    }

    public static boolean isSinglePointer(Type type) {
        return type instanceof PointerType pt && pt.isSingle();
    }

    public static boolean isConstPtr(Type type) {
        return type instanceof PointerType pt && pt.isConst();
    }

    public static boolean isVolatilePtr(Type type) {
        return type instanceof PointerType pt && pt.isVolatile();
    }

    public static boolean isCPtr(Type type) {
        return type instanceof PointerType pt && pt.size() == PointerType.Size.C;
    }

    /**
     * @return The element type of a pointer or array, or {@code null} for other types.
     */
    public static Type elemType(Type type) {
        if (type instanceof PointerType pt) {
            return pt.elem();
        }
        if (type instanceof ArrayType at) {
            return at.elem();
        }
        return null;
    }

    /**
     * @return The sentinel of an array or pointer type, or {@code null}.
     */
    public static Value sentinel(Type type) {
        if (type instanceof PointerType pt) {
            return pt.sentinel();
        }
        if (type instanceof ArrayType at) {
            return at.sentinel();
        }
        return null;
    }

    /**
     * @return {@code true} if elements can be addressed by index.
     */
    public static boolean isIndexable(Type type) {
        if (type instanceof ArrayType) {
            return true;
        }
        if (type instanceof PointerType pt) {
            return pt.size() != PointerType.Size.ONE || pt.elem() instanceof ArrayType;
        }
        return false;
    }

    /**
     * @return {@code true} if the type has exactly one value and so needs no runtime storage.
     */
    public static boolean hasOnePossibleValue(Type type) {
        if (type == SimpleType.VOID) {
            return true;
        }
        if (type instanceof IntType it) {
            return it.bits() == 0;
        }
        if (type instanceof ArrayType at) {
            return at.len() == 0 || hasOnePossibleValue(at.elem());
        }
        return false;
    }

    /**
     * @return {@code true} if values of this type can only exist at compile time.
     */
    public static boolean requiresComptime(Type type) {
        return switch (type.kind()) {
            case COMPTIME_INT, COMPTIME_FLOAT, TYPE, ENUM_LITERAL, NULL, UNDEFINED -> true;
            case POINTER -> requiresComptime(((PointerType) type).elem());
            case OPTIONAL -> requiresComptime(((OptionalType) type).child());
            case ARRAY -> requiresComptime(((ArrayType) type).elem());
            default -> false;
        };
    }

    /**
     * @return {@code true} if a value of {@code src} may be reinterpreted as {@code dest} bit for bit.
     */
    public static boolean inMemoryCoercible(Type dest, Type src) {
        if (dest.equals(src)) {
            return true;
        }
        if (dest instanceof PointerType d && src instanceof PointerType s) {
            // Only adding const or volatile qualifiers is allowed.
            return d.size() == s.size()
                    && (d.isConst() || s.mutable())
                    && (d.isVolatile() || !s.isVolatile())
                    && d.allowZero() == s.allowZero()
                    && java.util.Objects.equals(d.sentinel(), s.sentinel())
                    && inMemoryCoercible(d.elem(), s.elem())
                    && (d.isConst() || d.elem().equals(s.elem()));
        }
        if (dest.kind() == TypeKind.ERROR_SET && src instanceof ErrorSetType s) {
            return dest == SimpleType.ANYERROR || ((ErrorSetType) dest).names().containsAll(s.names());
        }
        return false;
    }

    /**
     * @param errorSet An error set type.
     * @param name     An error name.
     * @return {@code true} if the set admits the error.
     */
    public static boolean errorSetAdmits(Type errorSet, String name) {
        if (errorSet == SimpleType.ANYERROR) {
            return true;
        }
        return errorSet instanceof ErrorSetType set && set.contains(name);
    }
}
