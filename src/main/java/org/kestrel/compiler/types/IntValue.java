package org.kestrel.compiler.types;

import java.math.BigInteger;

/**
 * An integer of arbitrary precision.
 */
public record IntValue(BigInteger value) implements Value {

    public static final IntValue ZERO = new IntValue(BigInteger.ZERO);
    public static final IntValue ONE = new IntValue(BigInteger.ONE);

    public static IntValue of(long value) {
        return new IntValue(BigInteger.valueOf(value));
    }

    public int signum() {
        return value.signum();
    }

    /**
     * @return The number of bits a two's-complement integer needs to hold this value;
     * 0 for zero, and one more than the magnitude for negative values.
     */
    public int bitCountTwosComp() {
        if (value.signum() == 0) {
            return 0;
        }
        return value.bitLength() + (value.signum() < 0 ? 1 : 0);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
