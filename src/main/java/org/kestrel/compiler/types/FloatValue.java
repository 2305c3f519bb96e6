package org.kestrel.compiler.types;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A floating point number.
 */
public record FloatValue(double value) implements Value {

    /**
     * @return {@code true} for a finite value that is not an integer; NaN and the infinities have no fraction.
     */
    public boolean hasFraction() {
        return isFinite() && value != Math.rint(value);
    }

    public boolean isFinite() {
        return Double.isFinite(value);
    }

    /**
     * @return The integral part; the value must be finite.
     */
    public BigInteger toBigInteger() {
        return new BigDecimal(value).toBigInteger();
    }

    @Override
    public String toString() {
        if (isFinite() && !hasFraction()) {
            return new BigDecimal(value).toBigInteger().toString();
        }
        return Double.toString(value);
    }
}
