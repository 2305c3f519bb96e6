package org.kestrel.compiler.types;

/**
 * A fixed-width floating point type.
 *
 * @param bits One of 16, 32, 64, 80 or 128.
 */
public record FloatType(int bits) implements Type {

    public FloatType {
        if (bits != 16 && bits != 32 && bits != 64 && bits != 80 && bits != 128) {
            throw new IllegalArgumentException("unsupported float width: " + bits);
        }
    }

    @Override
    public TypeKind kind() {
        return TypeKind.FLOAT;
    }

    /**
     * @return The largest finite magnitude of this type, as far as a {@code double} can express it.
     */
    public double maxFinite() {
        switch (bits) {
            case 16:
                return 65504.0;
            case 32:
                return Float.MAX_VALUE;
            default:
                return Double.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "f" + bits;
    }
}
