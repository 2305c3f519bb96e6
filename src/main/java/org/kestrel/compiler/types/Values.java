package org.kestrel.compiler.types;

import java.math.BigInteger;

/**
 * Queries over compile-time {@link Value}s.
 */
public final class Values {

    private Values() {}

    /**
     * @return The integral value of an integer value, or of a float value without fraction.
     * @throws IllegalArgumentException for other values.
     */
    public static BigInteger toBigInteger(Value value) {
        if (value instanceof IntValue iv) {
            return iv.value();
        }
        if (value instanceof FloatValue fv) {
            return fv.toBigInteger();
        }
        if (value instanceof BoolValue bv) {
            return bv.value() ? BigInteger.ONE : BigInteger.ZERO;
        }
        throw new IllegalArgumentException("not an integer value: " + value);
    }

    public static boolean isNumeric(Value value) {
        return value instanceof IntValue || value instanceof FloatValue;
    }

    public static long toLong(Value value) {
        return toBigInteger(value).longValueExact();
    }

    public static double toDouble(Value value) {
        if (value instanceof FloatValue fv) {
            return fv.value();
        }
        if (value instanceof IntValue iv) {
            return iv.value().doubleValue();
        }
        throw new IllegalArgumentException("not a numeric value: " + value);
    }

    public static boolean toBool(Value value) {
        if (value instanceof BoolValue bv) {
            return bv.value();
        }
        throw new IllegalArgumentException("not a bool value: " + value);
    }

    /**
     * @return The type held by a type value.
     */
    public static Type toType(Value value) {
        if (value instanceof TypeValue tv) {
            return tv.type();
        }
        throw new IllegalArgumentException("not a type value: " + value);
    }

    /**
     * @return The error name if the value is an error, otherwise {@code null}.
     */
    public static String getError(Value value) {
        return value instanceof ErrorValue ev ? ev.name() : null;
    }

    /**
     * @return The sign of a numeric value.
     */
    public static int signum(Value value) {
        if (value instanceof IntValue iv) {
            return iv.signum();
        }
        if (value instanceof FloatValue fv) {
            return (int) Math.signum(fv.value());
        }
        throw new IllegalArgumentException("not a numeric value: " + value);
    }

    /**
     * Compares two numeric values exactly.
     *
     * @return Negative, zero or positive like {@link Comparable#compareTo}.
     */
    public static int compareNumeric(Value lhs, Value rhs) {
        if (lhs instanceof IntValue l && rhs instanceof IntValue r) {
            return l.value().compareTo(r.value());
        }
        return Double.compare(toDouble(lhs), toDouble(rhs));
    }

    /**
     * Loads the value a compile-time-known pointer points to.
     *
     * @param pointer A pointer value.
     * @return The pointee.
     * @throws IllegalStateException if the pointer is not compile-time dereferenceable.
     */
    public static Value pointerDeref(Value pointer) {
        if (pointer instanceof RefValue ref) {
            return ref.pointee();
        }
        if (pointer instanceof DeclRefValue declRef) {
            return declRef.decl().typedValue().value();
        }
        if (pointer instanceof ElemPtrValue elemPtr) {
            return elementAt(pointerDeref(elemPtr.arrayPtr()), elemPtr.index());
        }
        throw new IllegalStateException("cannot dereference " + pointer + " at compile time");
    }

    /**
     * @param array An array value.
     * @param index The element index; the index equal to the length reads the sentinel.
     * @return The element value.
     */
    public static Value elementAt(Value array, long index) {
        if (array instanceof BytesValue bytes) {
            if (index == bytes.length()) {
                return IntValue.ZERO;
            }
            return IntValue.of(bytes.byteAt((int) index));
        }
        if (array.isUndef()) {
            return SimpleValue.UNDEF;
        }
        throw new IllegalStateException("not an array value: " + array);
    }

    /**
     * Reads a compile-time string from a slice or pointer value.
     *
     * @return The bytes decoded as UTF-8, or {@code null} if the value does not lead to string bytes.
     */
    public static String toText(Value value) {
        if (value instanceof BytesValue bytes) {
            return bytes.text();
        }
        if (value instanceof RefValue || value instanceof DeclRefValue) {
            return toText(pointerDeref(value));
        }
        return null;
    }
}
