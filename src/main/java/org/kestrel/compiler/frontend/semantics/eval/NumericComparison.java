package org.kestrel.compiler.frontend.semantics.eval;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.ir.IrBinOp;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.types.FloatType;
import org.kestrel.compiler.types.FloatValue;
import org.kestrel.compiler.types.IntType;
import org.kestrel.compiler.types.IntValue;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Comparison of two numbers of possibly different types.
 * <p>
 * Compile-time-known operands are compared exactly. Otherwise both operands are cast to a type that
 * holds every value of either: the wider float, or an integer type that is signed if either side is
 * signed, with one extra bit for the unsigned side.
 */
public final class NumericComparison {

    private final Sema sema;

    public NumericComparison(Sema sema) {
        this.sema = sema;
    }

    public static boolean compare(Tag op, int cmp) {
        switch (op) {
            case CMP_LT:
                return cmp < 0;
            case CMP_LTE:
                return cmp <= 0;
            case CMP_EQ:
                return cmp == 0;
            case CMP_GTE:
                return cmp >= 0;
            case CMP_GT:
                return cmp > 0;
            case CMP_NEQ:
                return cmp != 0;
            default:
                throw new IllegalArgumentException("not a comparison opcode: " + op);
        }
    }

    public static IrTag irTag(Tag op) {
        switch (op) {
            case CMP_LT:
                return IrTag.CMP_LT;
            case CMP_LTE:
                return IrTag.CMP_LTE;
            case CMP_EQ:
                return IrTag.CMP_EQ;
            case CMP_GTE:
                return IrTag.CMP_GTE;
            case CMP_GT:
                return IrTag.CMP_GT;
            case CMP_NEQ:
                return IrTag.CMP_NEQ;
            default:
                throw new IllegalArgumentException("not a comparison opcode: " + op);
        }
    }

    public IrInst cmpNumeric(Block block, SourceInfo source, Tag op, IrInst lhs, IrInst rhs)
            throws SemanticException {
        Type lhsType = lhs.type();
        Type rhsType = rhs.type();
        if (!Types.isNumeric(lhsType) || !Types.isNumeric(rhsType)) {
            throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS,
                    "invalid operands to binary expression: '%s' and '%s'", lhsType, rhsType);
        }

        Value lhsValue = lhs.value();
        Value rhsValue = rhs.value();
        if (lhsValue != null && rhsValue != null) {
            if (lhsValue.isUndef() || rhsValue.isUndef()) {
                return sema.constUndef(block, source, SimpleType.BOOL);
            }
            return sema.constBool(block, source, compare(op, Values.compareNumeric(lhsValue, rhsValue)));
        }

        boolean lhsFloat = Types.isFloatOrComptimeFloat(lhsType);
        boolean rhsFloat = Types.isFloatOrComptimeFloat(rhsType);
        // A runtime integer against a known float is compared as integers.
        if (!lhsFloat && rhsValue instanceof FloatValue fv) {
            IrInst decided = decideAgainstInteger(block, source, op, fv, false);
            if (decided != null) {
                return decided;
            }
            rhs = sema.constInst(block, rhs.source(), SimpleType.COMPTIME_INT, integerOperand(op, fv, false));
            rhsType = SimpleType.COMPTIME_INT;
            rhsFloat = false;
        } else if (!rhsFloat && lhsValue instanceof FloatValue fv) {
            IrInst decided = decideAgainstInteger(block, source, op, fv, true);
            if (decided != null) {
                return decided;
            }
            lhs = sema.constInst(block, lhs.source(), SimpleType.COMPTIME_INT, integerOperand(op, fv, true));
            lhsType = SimpleType.COMPTIME_INT;
            lhsFloat = false;
        }

        Block b = sema.requireRuntimeBlock(block, source);
        Type destType;
        if (lhsFloat || rhsFloat) {
            destType = widerFloat(lhsType, rhsType);
        } else {
            destType = commonIntType(lhs, rhs);
        }
        IrInst castedLhs = sema.coerce(b, destType, lhs);
        IrInst castedRhs = sema.coerce(b, destType, rhs);
        return b.add(new IrBinOp(irTag(op), SimpleType.BOOL, castedLhs, castedRhs, source));
    }

    private static Type widerFloat(Type lhs, Type rhs) {
        if (lhs instanceof FloatType l && rhs instanceof FloatType r) {
            return l.bits() >= r.bits() ? l : r;
        }
        // One side is runtime, so at least one side has a sized type.
        if (lhs instanceof FloatType) {
            return lhs;
        }
        if (rhs instanceof FloatType) {
            return rhs;
        }
        return Types.F128;
    }

    private static Type commonIntType(IrInst lhs, IrInst rhs) {
        boolean lhsSigned = isSigned(lhs);
        boolean rhsSigned = isSigned(rhs);
        boolean signed = lhsSigned || rhsSigned;
        int bits = Math.max(bitsNeeded(lhs, lhsSigned, signed), bitsNeeded(rhs, rhsSigned, signed));
        return Types.intType(signed, Math.max(bits, 1));
    }

    private static boolean isSigned(IrInst inst) {
        if (inst.type() instanceof IntType intType) {
            return intType.isSigned();
        }
        return Values.signum(inst.value()) < 0;
    }

    private static int bitsNeeded(IrInst inst, boolean sideSigned, boolean destSigned) {
        int bits;
        if (inst.type() instanceof IntType intType) {
            bits = intType.bits();
        } else {
            IntValue value = new IntValue(Values.toBigInteger(inst.value()));
            bits = sideSigned ? value.bitCountTwosComp() : value.value().bitLength();
        }
        return destSigned && !sideSigned ? bits + 1 : bits;
    }

    /**
     * Folds comparisons of an integer with a float whose result does not depend on the integer: NaN,
     * the infinities, and equality with a fractional value.
     *
     * @return The folded result, or {@code null} if the integer must be compared at runtime.
     */
    private IrInst decideAgainstInteger(Block block, SourceInfo source, Tag op, FloatValue bound, boolean boundIsLhs) {
        double value = bound.value();
        if (Double.isNaN(value)) {
            return sema.constBool(block, source, op == Tag.CMP_NEQ);
        }
        if (Double.isInfinite(value)) {
            // ordering of the integer relative to the bound
            int cmp = value > 0 ? -1 : 1;
            return sema.constBool(block, source, compare(op, boundIsLhs ? -cmp : cmp));
        }
        if (bound.hasFraction() && (op == Tag.CMP_EQ || op == Tag.CMP_NEQ)) {
            return sema.constBool(block, source, op == Tag.CMP_NEQ);
        }
        return null;
    }

    private static IntValue integerOperand(Tag op, FloatValue bound, boolean boundIsLhs) {
        return bound.hasFraction() ? integerBound(op, bound, boundIsLhs) : new IntValue(bound.toBigInteger());
    }

    /**
     * Replaces a fractional bound by an integer that gives the same ordering result against any integer.
     *
     * @param boundIsLhs {@code true} if the float is the left operand.
     */
    private static IntValue integerBound(Tag op, FloatValue bound, boolean boundIsLhs) {
        BigDecimal exact = new BigDecimal(bound.value());
        BigInteger floor = exact.setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
        BigInteger ceil = exact.setScale(0, RoundingMode.CEILING).toBigIntegerExact();
        // x < 1.5 == x < 2, x >= 1.5 == x >= 2, x <= 1.5 == x <= 1, x > 1.5 == x > 1
        boolean useCeil = op == Tag.CMP_LT || op == Tag.CMP_GTE;
        if (boundIsLhs) {
            // 1.5 < x == x > 1.5
            useCeil = !useCeil;
        }
        return new IntValue(useCeil ? ceil : floor);
    }
}
