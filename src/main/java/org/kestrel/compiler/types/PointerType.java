package org.kestrel.compiler.types;

/**
 * A pointer type.
 *
 * @param size       Single-item, many-item, slice or C pointer.
 * @param elem       The pointee (element) type.
 * @param mutable    {@code false} for pointers to const.
 * @param isVolatile Whether the pointee is volatile.
 * @param allowZero  Whether address zero is a valid pointer value.
 * @param sentinel   Terminating value for many-item pointers and slices, or {@code null}.
 */
public record PointerType(Size size, Type elem, boolean mutable, boolean isVolatile, boolean allowZero,
                          Value sentinel) implements Type {

    /**
     * The pointer flavours.
     */
    public enum Size {
        ONE,
        MANY,
        SLICE,
        C
    }

    @Override
    public TypeKind kind() {
        return TypeKind.POINTER;
    }

    public boolean isConst() {
        return !mutable;
    }

    public boolean isSingle() {
        return size == Size.ONE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        switch (size) {
            case ONE:
                sb.append('*');
                break;
            case MANY:
                sb.append(sentinel == null ? "[*]" : "[*:" + sentinel + "]");
                break;
            case SLICE:
                sb.append(sentinel == null ? "[]" : "[:" + sentinel + "]");
                break;
            case C:
                sb.append("[*c]");
                break;
        }
        if (allowZero && size != Size.C) {
            sb.append("allowzero ");
        }
        if (!mutable) {
            sb.append("const ");
        }
        if (isVolatile) {
            sb.append("volatile ");
        }
        return sb.append(elem).toString();
    }
}
