package org.kestrel.compiler.frontend.untyped;

import org.kestrel.compiler.types.PointerType;
import org.kestrel.compiler.types.Signedness;

import java.math.BigInteger;

/**
 * Operand layouts of untyped instructions. Operands named {@code lhs}, {@code operand} and the like are {@link Ref}s.
 */
public sealed interface InstData {

    record Bin(int lhs, int rhs) implements InstData {}

    record UnNode(int operand) implements InstData {}

    /** Points at a payload in {@link UntypedCode#extra()}. */
    record PlNode(int payloadIndex) implements InstData {}

    /** A slice of {@link UntypedCode#strings()}. */
    record Str(int start, int len) implements InstData {}

    record StrOp(int start, int len, int operand) implements InstData {}

    record Int(BigInteger value) implements InstData {}

    record Float(double value) implements InstData {}

    /** {@code blockInst} is the instruction index of the target block, not a ref. */
    record Break(int blockInst, int operand) implements InstData {}

    record Node() implements InstData {}

    record ParamType(int callee, int paramIndex) implements InstData {}

    record PtrTypeSimple(int elemType, PointerType.Size size, boolean mutable, boolean isVolatile,
                         boolean allowZero) implements InstData {}

    record IntType(Signedness signedness, int bits) implements InstData {}
}
