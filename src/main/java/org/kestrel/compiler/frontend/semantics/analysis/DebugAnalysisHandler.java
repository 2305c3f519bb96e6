package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.SafetyChecks;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrNoOp;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Types;

import java.math.BigInteger;
import java.util.StringJoiner;

/**
 * Handles the semantic analysis of result checks, user diagnostics, breakpoints, {@code unreachable}
 * and the evaluation branch quota.
 */
public class DebugAnalysisHandler implements IInstructionHandler {

    private static final BigInteger MAX_QUOTA = BigInteger.valueOf(Integer.MAX_VALUE);

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        SourceInfo source = instruction.source();
        switch (instruction.tag()) {
            case ENSURE_RESULT_USED: {
                IrInst operand = sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand());
                TypeKind kind = operand.type().kind();
                if (kind != TypeKind.VOID && kind != TypeKind.NO_RETURN) {
                    throw sema.fail(source, "expression value is ignored");
                }
                return sema.constVoid(block, source);
            }
            case ENSURE_RESULT_NON_ERROR: {
                IrInst operand = sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand());
                TypeKind kind = operand.type().kind();
                if (kind == TypeKind.ERROR_SET || kind == TypeKind.ERROR_UNION) {
                    throw sema.fail(source, "error is discarded");
                }
                return sema.constVoid(block, source);
            }
            case COMPILE_ERROR: {
                String message = sema.resolveConstString(block, instruction.data(InstData.UnNode.class).operand());
                throw sema.fail(source, CompilerErrorCode.USER_COMPILE_ERROR, "%s", message);
            }
            case COMPILE_LOG:
                return analyzeCompileLog(sema, block, instruction);
            case BREAKPOINT: {
                Block b = sema.requireRuntimeBlock(block, source);
                return b.add(new IrNoOp(IrTag.BREAKPOINT, SimpleType.VOID, source));
            }
            case UNREACHABLE_SAFE:
            case UNREACHABLE_UNSAFE: {
                Block b = sema.requireRuntimeBlock(block, source);
                if (instruction.tag() == Tag.UNREACHABLE_SAFE
                        && sema.wantSafety()) {
                    return SafetyChecks.panic(b, source, SafetyChecks.PanicId.UNREACH);
                }
                return b.add(new IrNoOp(IrTag.UNREACH, SimpleType.NO_RETURN, source));
            }
            case SET_EVAL_BRANCH_QUOTA: {
                BigInteger quota = sema.resolveInt(block, instruction.data(InstData.UnNode.class).operand(),
                        Types.U32);
                block.quota().raiseTo(quota.min(MAX_QUOTA).intValueExact());
                return sema.constVoid(block, source);
            }
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }

    private IrInst analyzeCompileLog(Sema sema, Block block, UntypedInstruction instruction) {
        SourceInfo source = instruction.source();
        int[] operands = block.code().readMultiOp(instruction.data(InstData.PlNode.class).payloadIndex());
        StringJoiner text = new StringJoiner(", ");
        for (int ref : operands) {
            IrInst operand = sema.resolveInst(block, ref);
            if (operand.value() != null) {
                text.add("@as(" + operand.type() + ", " + operand.value() + ")");
            } else {
                text.add("@as(" + operand.type() + ", [runtime value])");
            }
        }
        sema.diagnostics().compileLog(source, text.toString());
        return sema.constVoid(block, source);
    }
}
