package org.kestrel.compiler.frontend.semantics.coercion;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.types.ArrayType;
import org.kestrel.compiler.types.ErrorUnionType;
import org.kestrel.compiler.types.FloatType;
import org.kestrel.compiler.types.FloatValue;
import org.kestrel.compiler.types.IntType;
import org.kestrel.compiler.types.IntValue;
import org.kestrel.compiler.types.OptionalType;
import org.kestrel.compiler.types.PointerType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.SimpleValue;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Implicit conversions between types.
 * <p>
 * Rules are tried in priority order; the first that applies decides the result:
 * <ol>
 *     <li>identity, then bit-for-bit compatible types (a {@code bitcast});</li>
 *     <li>an undefined value becomes undefined of the destination type;</li>
 *     <li>{@code null} and {@code T} into {@code ?T};</li>
 *     <li>a payload or an error into an error union;</li>
 *     <li>a single pointer to an array into a slice, many-item or C pointer;</li>
 *     <li>a compile-time-known number into another number type, checked to fit;</li>
 *     <li>runtime integer and float widening.</li>
 * </ol>
 */
public final class Coercion {

    private final Sema sema;

    public Coercion(Sema sema) {
        this.sema = sema;
    }

    public IrInst coerce(Block block, Type dest, IrInst inst) throws SemanticException {
        if (dest == SimpleType.VAR_ARGS_PARAM) {
            return coerceVarArgParam(inst);
        }
        Type srcType = inst.type();
        if (dest.equals(srcType)) {
            return inst;
        }
        if (Types.inMemoryCoercible(dest, srcType)) {
            return bitcast(block, dest, inst);
        }

        Value value = inst.value();
        if ((value != null && value.isUndef()) || srcType == SimpleType.UNDEFINED) {
            return sema.constUndef(block, inst.source(), dest);
        }

        if (dest instanceof OptionalType optional) {
            if (srcType == SimpleType.NULL) {
                return sema.constInst(block, inst.source(), dest, SimpleValue.NULL);
            }
            if (optional.child().equals(srcType)) {
                return wrapOptional(block, dest, inst);
            }
            IrInst coercedChild = coerceNum(block, optional.child(), inst);
            if (coercedChild != null) {
                return wrapOptional(block, dest, coercedChild);
            }
        }

        if (dest instanceof ErrorUnionType errorUnion) {
            return wrapErrorUnion(block, errorUnion, inst);
        }

        IrInst fromArrayPtr = coerceArrayPtr(block, dest, inst);
        if (fromArrayPtr != null) {
            return fromArrayPtr;
        }

        IrInst number = coerceNum(block, dest, inst);
        if (number != null) {
            return number;
        }

        if (srcType instanceof IntType src && dest instanceof IntType dst) {
            boolean sameSignWider = src.signedness() == dst.signedness() && dst.bits() >= src.bits();
            boolean unsignedIntoWiderSigned = dst.isSigned() && !src.isSigned() && dst.bits() > src.bits();
            if (sameSignWider || unsignedIntoWiderSigned) {
                Block b = sema.requireRuntimeBlock(block, inst.source());
                return b.add(new IrUnOp(IrTag.INTCAST, dest, inst, inst.source()));
            }
        }

        if (srcType instanceof FloatType src && dest instanceof FloatType dst && dst.bits() >= src.bits()) {
            Block b = sema.requireRuntimeBlock(block, inst.source());
            return b.add(new IrUnOp(IrTag.FLOATCAST, dest, inst, inst.source()));
        }

        throw sema.fail(inst.source(), CompilerErrorCode.TYPE_MISMATCH, "expected %s, found %s", dest, srcType);
    }

    /**
     * Reinterprets a value; compile-time-known values keep their value.
     */
    public IrInst bitcast(Block block, Type dest, IrInst inst) throws SemanticException {
        if (inst.value() != null) {
            return sema.constInst(block, inst.source(), dest, inst.value());
        }
        Block b = sema.requireRuntimeBlock(block, inst.source());
        return b.add(new IrUnOp(IrTag.BITCAST, dest, inst, inst.source()));
    }

    /**
     * Converts a compile-time-known number into another number type.
     *
     * @return The converted constant, or {@code null} if the operand is not a compile-time-known number.
     */
    public IrInst coerceNum(Block block, Type dest, IrInst inst) throws SemanticException {
        Value value = inst.value();
        if (value == null) {
            return null;
        }
        Type srcType = inst.type();
        SourceInfo source = inst.source();
        boolean srcInt = Types.isIntOrComptimeInt(srcType);
        boolean srcFloat = Types.isFloatOrComptimeFloat(srcType);

        if (Types.isIntOrComptimeInt(dest)) {
            if (srcFloat) {
                FloatValue floatValue = (FloatValue) value;
                if (!floatValue.isFinite()) {
                    throw sema.fail(source, CompilerErrorCode.VALUE_DOES_NOT_FIT,
                            "float value '%s' cannot be stored in integer type '%s'", value, dest);
                }
                if (floatValue.hasFraction()) {
                    throw sema.fail(source, CompilerErrorCode.VALUE_DOES_NOT_FIT,
                            "fractional component prevents float value %s from being casted to type '%s'", value, dest);
                }
                return checkedInt(block, source, dest, floatValue.toBigInteger());
            }
            if (srcInt) {
                return checkedInt(block, source, dest, Values.toBigInteger(value));
            }
        } else if (Types.isFloatOrComptimeFloat(dest)) {
            if (srcFloat) {
                return checkedFloat(block, source, dest, ((FloatValue) value).value(), value);
            }
            if (srcInt) {
                BigInteger integer = Values.toBigInteger(value);
                return checkedFloat(block, source, dest, integer.doubleValue(), value);
            }
        }
        return null;
    }

    private IrInst checkedInt(Block block, SourceInfo source, Type dest, BigInteger integer) throws SemanticException {
        if (dest instanceof IntType intType && !intType.fits(integer)) {
            throw sema.fail(source, CompilerErrorCode.VALUE_DOES_NOT_FIT,
                    "type %s cannot represent integer value %s", dest, integer);
        }
        return sema.constInst(block, source, dest, new IntValue(integer));
    }

    private IrInst checkedFloat(Block block, SourceInfo source, Type dest, double converted, Value original)
            throws SemanticException {
        if (dest instanceof FloatType floatType && Double.isFinite(converted)
                && Math.abs(converted) > floatType.maxFinite()) {
            throw sema.fail(source, CompilerErrorCode.VALUE_DOES_NOT_FIT,
                    "cast of value %s to type '%s' loses information", original, dest);
        }
        return sema.constInst(block, source, dest, new FloatValue(converted));
    }

    private IrInst coerceVarArgParam(IrInst inst) throws SemanticException {
        TypeKind kind = inst.type().kind();
        if (kind == TypeKind.COMPTIME_INT || kind == TypeKind.COMPTIME_FLOAT) {
            throw sema.fail(inst.source(), CompilerErrorCode.TYPE_MISMATCH,
                    "integer and float literals in var args function must be casted");
        }
        return inst;
    }

    private IrInst wrapOptional(Block block, Type dest, IrInst inst) throws SemanticException {
        if (inst.value() != null) {
            return sema.constInst(block, inst.source(), dest, inst.value());
        }
        Block b = sema.requireRuntimeBlock(block, inst.source());
        return b.add(new IrUnOp(IrTag.WRAP_OPTIONAL, dest, inst, inst.source()));
    }

    private IrInst wrapErrorUnion(Block block, ErrorUnionType dest, IrInst inst) throws SemanticException {
        boolean isError = inst.type().kind() == TypeKind.ERROR_SET;
        Value value = inst.value();
        if (value != null) {
            if (isError) {
                String name = Values.getError(value);
                if (!Types.errorSetAdmits(dest.errorSet(), name)) {
                    throw sema.fail(inst.source(), CompilerErrorCode.TYPE_MISMATCH,
                            "expected type '%s', found type '%s'", dest.errorSet(), inst.type());
                }
                return sema.constInst(block, inst.source(), dest, value);
            }
            IrInst payload = coerce(block, dest.payload(), inst);
            return sema.constInst(block, inst.source(), dest, payload.value());
        }

        Block b = sema.requireRuntimeBlock(block, inst.source());
        if (isError) {
            IrInst coerced = coerce(block, dest.errorSet(), inst);
            return b.add(new IrUnOp(IrTag.WRAP_ERRUNION_ERR, dest, coerced, inst.source()));
        }
        IrInst coerced = coerce(block, dest.payload(), inst);
        return b.add(new IrUnOp(IrTag.WRAP_ERRUNION_PAYLOAD, dest, coerced, inst.source()));
    }

    /**
     * {@code *[N]T} into {@code []T}, {@code [*c]T} and {@code [*]T}; {@code *[N:s]T} into {@code [*:s]T}.
     *
     * @return The converted pointer, or {@code null} if the rule does not apply.
     */
    private IrInst coerceArrayPtr(Block block, Type dest, IrInst inst) throws SemanticException {
        if (!(inst.type() instanceof PointerType src) || !src.isSingle()
                || !(src.elem() instanceof ArrayType array) || !(dest instanceof PointerType dst)) {
            return null;
        }
        if (src.isConst() && !dst.isConst()) {
            return null;
        }
        if (src.isVolatile() && !dst.isVolatile()) {
            return null;
        }
        if (!Types.inMemoryCoercible(dst.elem(), array.elem())) {
            return null;
        }
        switch (dst.size()) {
            case SLICE:
                return coerceArrayPtrToSlice(block, dest, inst);
            case C:
                return coerceArrayPtrToMany(block, dest, inst);
            case MANY:
                if (array.sentinel() == null && dst.sentinel() == null) {
                    return coerceArrayPtrToMany(block, dest, inst);
                }
                if (array.sentinel() != null && Objects.equals(array.sentinel(), dst.sentinel())) {
                    return coerceArrayPtrToMany(block, dest, inst);
                }
                return null;
            default:
                return null;
        }
    }

    private IrInst coerceArrayPtrToSlice(Block block, Type dest, IrInst inst) throws SemanticException {
        if (inst.value() != null) {
            return sema.constInst(block, inst.source(), dest, inst.value());
        }
        throw sema.fail(inst.source(), CompilerErrorCode.NOT_IMPLEMENTED,
                "TODO implement coerceArrayPtrToSlice runtime instruction");
    }

    private IrInst coerceArrayPtrToMany(Block block, Type dest, IrInst inst) throws SemanticException {
        return bitcast(block, dest, inst);
    }
}
