package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Types;

/**
 * Handles the semantic analysis of explicit casts. The first operand is the destination type.
 */
public class CastAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        InstData.Bin bin = instruction.data(InstData.Bin.class);
        Type dest = sema.resolveType(block, bin.lhs());
        IrInst operand = sema.resolveInst(block, bin.rhs());
        switch (instruction.tag()) {
            case AS:
                return sema.coerce(block, dest, operand);
            case INTCAST:
                return analyzeIntCast(sema, block, instruction.source(), dest, operand);
            case FLOATCAST:
                return analyzeFloatCast(sema, block, instruction.source(), dest, operand);
            case BITCAST:
                return sema.bitcast(block, dest, operand);
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }

    private IrInst analyzeIntCast(Sema sema, Block block, SourceInfo source, Type dest, IrInst operand)
            throws SemanticException {
        if (!Types.isIntOrComptimeInt(dest)) {
            throw sema.fail(source, CompilerErrorCode.TYPE_MISMATCH, "expected integer type, found '%s'", dest);
        }
        if (!Types.isIntOrComptimeInt(operand.type())) {
            throw sema.fail(operand.source(), CompilerErrorCode.TYPE_MISMATCH,
                    "expected integer type, found '%s'", operand.type());
        }
        if (operand.value() != null) {
            return sema.coerce(block, dest, operand);
        }
        if (dest.kind() == TypeKind.COMPTIME_INT) {
            throw sema.fail(source, CompilerErrorCode.NOT_COMPTIME_KNOWN,
                    "unable to cast runtime value to 'comptime_int'");
        }
        if (dest.equals(operand.type())) {
            return operand;
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.INTCAST, dest, operand, source));
    }

    private IrInst analyzeFloatCast(Sema sema, Block block, SourceInfo source, Type dest, IrInst operand)
            throws SemanticException {
        if (!Types.isFloatOrComptimeFloat(dest)) {
            throw sema.fail(source, CompilerErrorCode.TYPE_MISMATCH, "expected float type, found '%s'", dest);
        }
        if (!Types.isFloatOrComptimeFloat(operand.type())) {
            throw sema.fail(operand.source(), CompilerErrorCode.TYPE_MISMATCH,
                    "expected float type, found '%s'", operand.type());
        }
        if (operand.value() != null) {
            return sema.coerce(block, dest, operand);
        }
        if (dest.kind() == TypeKind.COMPTIME_FLOAT) {
            throw sema.fail(source, CompilerErrorCode.NOT_COMPTIME_KNOWN,
                    "unable to cast runtime value to 'comptime_float'");
        }
        if (dest.equals(operand.type())) {
            return operand;
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.FLOATCAST, dest, operand, source));
    }
}
