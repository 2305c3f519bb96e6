package org.kestrel.compiler.frontend.semantics.eval;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.DiagnosticsSink;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.types.FloatValue;
import org.kestrel.compiler.types.IntType;
import org.kestrel.compiler.types.IntValue;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

import java.math.BigInteger;

/**
 * Folds arithmetic and bitwise operations on compile-time-known operands.
 * <p>
 * Literal integers are exact. Sized integers are overflow-checked, except for the wrapping
 * operators, which wrap in two's complement.
 */
public final class ComptimeArithmetic {

    private final DiagnosticsSink sink;

    public ComptimeArithmetic(DiagnosticsSink sink) {
        this.sink = sink;
    }

    /**
     * @param op     A binary arithmetic, bitwise or shift opcode.
     * @param type   The operand and result type.
     * @param lhs    The defined left operand.
     * @param rhs    The defined right operand.
     * @param source The location of the operation.
     * @return The folded value.
     */
    public Value fold(Tag op, Type type, Value lhs, Value rhs, SourceInfo source) throws SemanticException {
        if (Types.isFloatOrComptimeFloat(type)) {
            return foldFloat(op, Values.toDouble(lhs), Values.toDouble(rhs), source);
        }
        BigInteger a = Values.toBigInteger(lhs);
        BigInteger b = Values.toBigInteger(rhs);
        BigInteger result;
        switch (op) {
            case ADD:
                return checked(type, a.add(b), source);
            case SUB:
                return checked(type, a.subtract(b), source);
            case MUL:
                return checked(type, a.multiply(b), source);
            case ADDWRAP:
                return new IntValue(wrap(type, a.add(b)));
            case SUBWRAP:
                return new IntValue(wrap(type, a.subtract(b)));
            case MULWRAP:
                return new IntValue(wrap(type, a.multiply(b)));
            case DIV:
                requireNonZero(b, source);
                return checked(type, a.divide(b), source);
            case MOD_REM:
                requireNonZero(b, source);
                return new IntValue(a.remainder(b));
            case BIT_AND:
                result = a.and(b);
                break;
            case BIT_OR:
                result = a.or(b);
                break;
            case XOR:
                result = a.xor(b);
                break;
            case SHL:
                return checked(type, a.shiftLeft(shiftAmount(b, source)), source);
            case SHR:
                return new IntValue(a.shiftRight(shiftAmount(b, source)));
            default:
                throw new IllegalArgumentException("not a binary arithmetic opcode: " + op);
        }
        return new IntValue(result);
    }

    /**
     * @return The bitwise complement within the bits of {@code type}.
     */
    public Value bitNot(Type type, Value operand) {
        BigInteger value = Values.toBigInteger(operand);
        if (type instanceof IntType intType && !intType.isSigned()) {
            return new IntValue(intType.maxValue().xor(value));
        }
        return new IntValue(value.not());
    }

    private Value foldFloat(Tag op, double a, double b, SourceInfo source) throws SemanticException {
        switch (op) {
            case ADD:
                return new FloatValue(a + b);
            case SUB:
                return new FloatValue(a - b);
            case MUL:
                return new FloatValue(a * b);
            case DIV:
                if (b == 0.0) {
                    throw sink.fail(source, CompilerErrorCode.ARITHMETIC_FAULT, "division by zero");
                }
                return new FloatValue(a / b);
            default:
                throw new IllegalArgumentException("not a float opcode: " + op);
        }
    }

    private Value checked(Type type, BigInteger value, SourceInfo source) throws SemanticException {
        if (type instanceof IntType intType && !intType.fits(value)) {
            throw sink.fail(source, CompilerErrorCode.ARITHMETIC_FAULT,
                    "overflow of integer type '%s' with value '%s'", type, value);
        }
        return new IntValue(value);
    }

    private void requireNonZero(BigInteger divisor, SourceInfo source) throws SemanticException {
        if (divisor.signum() == 0) {
            throw sink.fail(source, CompilerErrorCode.ARITHMETIC_FAULT, "division by zero");
        }
    }

    private int shiftAmount(BigInteger amount, SourceInfo source) throws SemanticException {
        if (amount.signum() < 0 || amount.bitLength() > 16) {
            throw sink.fail(source, CompilerErrorCode.ARITHMETIC_FAULT, "shift amount %s is out of range", amount);
        }
        return amount.intValue();
    }

    /**
     * Reduces a value to the bits of a sized integer type in two's complement; literal integers are unchanged.
     */
    static BigInteger wrap(Type type, BigInteger value) {
        if (!(type instanceof IntType intType)) {
            return value;
        }
        if (intType.bits() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger modulus = BigInteger.ONE.shiftLeft(intType.bits());
        BigInteger wrapped = value.mod(modulus);
        if (intType.isSigned() && wrapped.compareTo(intType.maxValue()) > 0) {
            wrapped = wrapped.subtract(modulus);
        }
        return wrapped;
    }
}
