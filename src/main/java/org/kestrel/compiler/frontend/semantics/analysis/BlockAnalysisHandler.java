package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrBlock;
import org.kestrel.compiler.ir.IrBody;
import org.kestrel.compiler.ir.IrBr;
import org.kestrel.compiler.ir.IrCondBr;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrLoop;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

/**
 * Handles the semantic analysis of structured control flow: blocks, breaks, loops and conditional branches.
 * <p>
 * A conditional branch on a compile-time-known condition analyzes only the selected body, directly into the
 * current block; its result is a {@code noreturn} constant so that the rest of the body is skipped.
 */
public class BlockAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        switch (instruction.tag()) {
            case BLOCK:
            case BLOCK_COMPTIME:
                return analyzeBlock(sema, block, inst, instruction);
            case BLOCK_FLAT:
            case BLOCK_COMPTIME_FLAT:
                return analyzeBlockFlat(sema, block, instruction);
            case BREAK:
            case BREAK_VOID:
                return analyzeBreak(sema, block, instruction);
            case LOOP:
                return analyzeLoop(sema, block, instruction);
            case CONDBR:
                return analyzeCondBr(sema, block, instruction);
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }

    private IrInst analyzeBlock(Sema sema, Block block, int inst, UntypedInstruction instruction)
            throws SemanticException {
        int[] body = block.code().readBody(instruction.data(InstData.PlNode.class).payloadIndex());
        // The type is only known once every break has been seen.
        IrBlock blockInst = new IrBlock(SimpleType.NO_RETURN, instruction.source());
        Block child = block.makeLabeledChild(inst, blockInst, instruction.tag() == Tag.BLOCK_COMPTIME);
        sema.analyzeBody(child, body);
        return child.label().merges().finish(sema, block, child);
    }

    private IrInst analyzeBlockFlat(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        int[] body = block.code().readBody(instruction.data(InstData.PlNode.class).payloadIndex());
        Block child = block.makeSubBlock(instruction.tag() == Tag.BLOCK_COMPTIME_FLAT);
        IrInst result = sema.analyzeBody(child, body);
        block.splice(child.instructions());
        return result != null ? result : sema.constVoid(block, instruction.source());
    }

    private IrInst analyzeBreak(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        InstData.Break data = instruction.data(InstData.Break.class);
        SourceInfo source = instruction.source();
        Block.Label label = block.findLabel(data.blockInst());
        if (label == null) {
            throw new IllegalStateException("break at " + source + " targets %" + data.blockInst()
                    + ", which is not an enclosing block");
        }
        IrInst operand = data.operand() == Ref.NONE
                ? sema.constVoid(block, source)
                : sema.resolveInst(block, data.operand());
        if (!block.isComptime()) {
            sema.requireFunctionBlock(block, source);
        }
        IrBr br = block.add(new IrBr(label.merges().blockInst(), operand, source));
        label.merges().addBreak(br);
        return br;
    }

    private IrInst analyzeLoop(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        int[] body = block.code().readBody(instruction.data(InstData.PlNode.class).payloadIndex());
        Block child = block.makeSubBlock();
        sema.analyzeBody(child, body);
        if (block.inlining() != null) {
            sema.emitBackwardBranch(block, instruction.source());
        }
        return block.add(new IrLoop(new IrBody(child.instructions()), instruction.source()));
    }

    private IrInst analyzeCondBr(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        SourceInfo source = instruction.source();
        UntypedCode.CondBrPayload payload =
                block.code().readCondBr(instruction.data(InstData.PlNode.class).payloadIndex());
        IrInst condition = sema.coerce(block, SimpleType.BOOL, sema.resolveInst(block, payload.condition()));

        Value value = sema.resolveDefinedValue(condition);
        if (value != null) {
            boolean taken = Values.toBool(value);
            CompilerLogger.trace("condbr at " + source + " folded to the " + (taken ? "then" : "else") + " body");
            sema.analyzeBody(block, taken ? payload.thenBody() : payload.elseBody());
            return sema.constNoReturn(block, source);
        }

        Block b = sema.requireRuntimeBlock(block, source);
        Block thenBlock = b.makeSubBlock();
        sema.analyzeBody(thenBlock, payload.thenBody());
        Block elseBlock = b.makeSubBlock();
        sema.analyzeBody(elseBlock, payload.elseBody());
        return b.add(new IrCondBr(condition, new IrBody(thenBlock.instructions()),
                new IrBody(elseBlock.instructions()), source));
    }
}
