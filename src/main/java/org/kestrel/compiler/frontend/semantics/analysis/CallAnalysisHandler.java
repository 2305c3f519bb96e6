package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.BlockMerge;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.CallModifier;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrBlock;
import org.kestrel.compiler.ir.IrBr;
import org.kestrel.compiler.ir.IrCall;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrNoOp;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.module.Function;
import org.kestrel.compiler.types.CallingConvention;
import org.kestrel.compiler.types.FnType;
import org.kestrel.compiler.types.FunctionValue;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the semantic analysis of calls and returns.
 * <p>
 * A call is inlined when it is evaluated at compile time, when the call site asks for it, or when the callee
 * uses the {@code Inline} calling convention. The callee body is then analyzed in a block of its own with the
 * coerced arguments standing in for its parameters; its returns become breaks to the call's result block.
 * Every inlined call counts one backward branch against the caller's quota.
 */
public class CallAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        if (instruction.tag() == Tag.RET) {
            return analyzeRet(sema, block, instruction);
        }
        UntypedCode.CallPayload payload = block.code().readCall(instruction.data(InstData.PlNode.class).payloadIndex());
        return analyzeCall(sema, block, instruction.source(), payload);
    }

    private IrInst analyzeCall(Sema sema, Block block, SourceInfo source, UntypedCode.CallPayload payload)
            throws SemanticException {
        IrInst callee = sema.resolveInst(block, payload.callee());
        if (!(callee.type() instanceof FnType fnType)) {
            throw sema.fail(source, CompilerErrorCode.NOT_CALLABLE, "type '%s' not a function", callee.type());
        }
        if (fnType.cc() == CallingConvention.NAKED) {
            throw sema.fail(source, CompilerErrorCode.NOT_CALLABLE,
                    "unable to call function with naked calling convention");
        }

        int paramCount = fnType.paramTypes().size();
        int argCount = payload.args().length;
        if (fnType.varArgs()) {
            if (argCount < paramCount) {
                throw sema.fail(source, CompilerErrorCode.WRONG_ARGUMENT_COUNT,
                        "expected at least %d argument(s), found %d", paramCount, argCount);
            }
        } else if (argCount != paramCount) {
            throw sema.fail(source, CompilerErrorCode.WRONG_ARGUMENT_COUNT,
                    "expected %d argument(s), found %d", paramCount, argCount);
        }

        List<IrInst> castedArgs = new ArrayList<>(argCount);
        for (int i = 0; i < argCount; i++) {
            Type paramType = i < paramCount ? fnType.paramTypes().get(i) : SimpleType.VAR_ARGS_PARAM;
            castedArgs.add(sema.coerce(block, paramType, sema.resolveInst(block, payload.args()[i])));
        }

        boolean isComptimeCall = block.isComptime() || payload.modifier() == CallModifier.COMPILE_TIME;
        boolean isInline = isComptimeCall
                || payload.modifier() == CallModifier.ALWAYS_INLINE
                || fnType.cc() == CallingConvention.INLINE;
        if (isInline) {
            return analyzeInlineCall(sema, block, source, callee, fnType, castedArgs, isComptimeCall);
        }

        Block b = sema.requireFunctionBlock(block, source);
        return b.add(new IrCall(fnType.returnType(), callee, castedArgs, source));
    }

    private IrInst analyzeInlineCall(Sema sema, Block block, SourceInfo source, IrInst callee, FnType fnType,
                                     List<IrInst> castedArgs, boolean isComptimeCall) throws SemanticException {
        Value calleeValue = sema.resolveConstValue(callee);
        if (!(calleeValue instanceof FunctionValue functionValue)) {
            throw new IllegalStateException("value of function type is not a function: " + calleeValue);
        }
        Function function = functionValue.function();
        if (function.isExtern()) {
            throw sema.fail(source, "%s call of extern function", isComptimeCall ? "comptime" : "inline");
        }

        IrBlock resultBlock = new IrBlock(fnType.returnType(), source);
        Block.Inlining inlining = new Block.Inlining(function, castedArgs, new BlockMerge(resultBlock));
        Block child = Block.forInlineCall(block, inlining, isComptimeCall);

        sema.emitBackwardBranch(block, source);
        if (CompilerLogger.isTraceEnabled()) {
            CompilerLogger.trace("inlining '" + function.name() + "' at " + source
                    + (isComptimeCall ? " (comptime)" : ""));
        }
        sema.analyzeBody(child, function.code().rootBody());
        return inlining.merges().finish(sema, block, child);
    }

    private IrInst analyzeRet(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        SourceInfo source = instruction.source();
        int ref = instruction.data(InstData.UnNode.class).operand();
        IrInst operand = ref == Ref.NONE ? sema.constVoid(block, source) : sema.resolveInst(block, ref);

        Block.Inlining inlining = block.inlining();
        if (inlining != null) {
            IrInst result = sema.coerce(block, inlining.callee().fnType().returnType(), operand);
            IrBr br = block.add(new IrBr(inlining.merges().blockInst(), result, source));
            inlining.merges().addBreak(br);
            return br;
        }

        Block b = sema.requireFunctionBlock(block, source);
        Type returnType = b.function().fnType().returnType();
        IrInst result = sema.coerce(b, returnType, operand);
        if (returnType.kind() == TypeKind.VOID) {
            return b.add(new IrNoOp(IrTag.RETVOID, SimpleType.NO_RETURN, source));
        }
        return b.add(new IrUnOp(IrTag.RET, SimpleType.NO_RETURN, result, source));
    }
}
