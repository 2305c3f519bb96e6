package org.kestrel.compiler.types;

import java.math.BigInteger;

/**
 * A fixed-width integer type such as {@code u8} or {@code i32}.
 *
 * @param signedness Whether the type is signed.
 * @param bits       The declared bit width, 0 to 65535.
 */
public record IntType(Signedness signedness, int bits) implements Type {

    /** Largest bit width an integer type may declare. */
    public static final int MAX_BITS = 65535;

    public IntType {
        if (bits < 0 || bits > MAX_BITS) {
            throw new IllegalArgumentException("integer bit width out of range: " + bits);
        }
    }

    @Override
    public TypeKind kind() {
        return TypeKind.INT;
    }

    public boolean isSigned() {
        return signedness == Signedness.SIGNED;
    }

    /**
     * @return The smallest representable value.
     */
    public BigInteger minValue() {
        if (!isSigned() || bits == 0) {
            return BigInteger.ZERO;
        }
        return BigInteger.ONE.shiftLeft(bits - 1).negate();
    }

    /**
     * @return The largest representable value.
     */
    public BigInteger maxValue() {
        if (bits == 0) {
            return BigInteger.ZERO;
        }
        int magnitudeBits = isSigned() ? bits - 1 : bits;
        return BigInteger.ONE.shiftLeft(magnitudeBits).subtract(BigInteger.ONE);
    }

    /**
     * @param value The value to check.
     * @return {@code true} if the value is representable in this type.
     */
    public boolean fits(BigInteger value) {
        return value.compareTo(minValue()) >= 0 && value.compareTo(maxValue()) <= 0;
    }

    @Override
    public String toString() {
        return (isSigned() ? "i" : "u") + bits;
    }
}
