package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrBinOp;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;

import java.util.List;

/**
 * Handles the semantic analysis of arithmetic and bitwise operations.
 * Operands are peer-resolved and coerced to a common type; compile-time-known operands are folded.
 */
public class ArithmeticAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        Tag tag = instruction.tag();
        if (tag == Tag.BIT_NOT) {
            return analyzeBitNot(sema, block, instruction);
        }
        InstData.Bin bin = instruction.data(InstData.Bin.class);
        IrInst lhs = sema.resolveInst(block, bin.lhs());
        IrInst rhs = sema.resolveInst(block, bin.rhs());
        if (tag == Tag.SHL || tag == Tag.SHR) {
            return analyzeShift(sema, block, instruction, lhs, rhs);
        }
        return analyzeArithmetic(sema, block, instruction, lhs, rhs);
    }

    private IrInst analyzeArithmetic(Sema sema, Block block, UntypedInstruction instruction, IrInst lhs, IrInst rhs)
            throws SemanticException {
        Tag tag = instruction.tag();
        SourceInfo source = instruction.source();
        Type type = sema.resolvePeerTypes(block, List.of(lhs, rhs));
        boolean intOperands = Types.isIntOrComptimeInt(type);
        boolean floatOperands = Types.isFloatOrComptimeFloat(type) && allowsFloats(tag);
        if (!intOperands && !floatOperands) {
            throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS,
                    "invalid operands to binary expression: '%s' and '%s'", lhs.type(), rhs.type());
        }
        IrInst castedLhs = sema.coerce(block, type, lhs);
        IrInst castedRhs = sema.coerce(block, type, rhs);

        Value lhsValue = castedLhs.value();
        Value rhsValue = castedRhs.value();
        if (lhsValue != null && rhsValue != null) {
            if (lhsValue.isUndef() || rhsValue.isUndef()) {
                return sema.constUndef(block, source, type);
            }
            return sema.constInst(block, source, type, sema.arithmetic().fold(tag, type, lhsValue, rhsValue, source));
        }

        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrBinOp(irTag(tag), type, castedLhs, castedRhs, source));
    }

    private IrInst analyzeShift(Sema sema, Block block, UntypedInstruction instruction, IrInst lhs, IrInst rhs)
            throws SemanticException {
        SourceInfo source = instruction.source();
        Type type = lhs.type();
        if (!Types.isIntOrComptimeInt(type) || !Types.isIntOrComptimeInt(rhs.type())) {
            throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS,
                    "invalid operands to binary expression: '%s' and '%s'", lhs.type(), rhs.type());
        }
        Value lhsValue = lhs.value();
        Value rhsValue = rhs.value();
        if (lhsValue != null && rhsValue != null) {
            if (lhsValue.isUndef() || rhsValue.isUndef()) {
                return sema.constUndef(block, source, type);
            }
            return sema.constInst(block, source, type,
                    sema.arithmetic().fold(instruction.tag(), type, lhsValue, rhsValue, source));
        }
        if (type.kind() == TypeKind.COMPTIME_INT) {
            throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS,
                    "LHS of shift must be an integer type, or RHS must be compile-time known");
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrBinOp(irTag(instruction.tag()), type, lhs, rhs, source));
    }

    private IrInst analyzeBitNot(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        SourceInfo source = instruction.source();
        IrInst operand = sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand());
        Type type = operand.type();
        if (!Types.isIntOrComptimeInt(type)) {
            throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS,
                    "unable to perform binary not operation on type '%s'", type);
        }
        Value value = operand.value();
        if (value != null) {
            if (value.isUndef()) {
                return sema.constUndef(block, source, type);
            }
            return sema.constInst(block, source, type, sema.arithmetic().bitNot(type, value));
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.NOT, type, operand, source));
    }

    private static boolean allowsFloats(Tag tag) {
        return tag == Tag.ADD || tag == Tag.SUB || tag == Tag.MUL || tag == Tag.DIV;
    }

    private static IrTag irTag(Tag tag) {
        switch (tag) {
            case ADD:
                return IrTag.ADD;
            case ADDWRAP:
                return IrTag.ADDWRAP;
            case SUB:
                return IrTag.SUB;
            case SUBWRAP:
                return IrTag.SUBWRAP;
            case MUL:
                return IrTag.MUL;
            case MULWRAP:
                return IrTag.MULWRAP;
            case DIV:
                return IrTag.DIV;
            case MOD_REM:
                return IrTag.MOD_REM;
            case BIT_AND:
                return IrTag.BIT_AND;
            case BIT_OR:
                return IrTag.BIT_OR;
            case XOR:
                return IrTag.XOR;
            case SHL:
                return IrTag.SHL;
            case SHR:
                return IrTag.SHR;
            default:
                throw new IllegalArgumentException("not an arithmetic opcode: " + tag);
        }
    }
}
