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
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.types.ErrorUnionType;
import org.kestrel.compiler.types.OptionalType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

/**
 * Handles the semantic analysis of optional and error union tests and unwraps.
 * <p>
 * Safe unwraps of runtime values get a safety check when the build mode wants one; unwrapping a
 * compile-time-known {@code null} or error is a compile error.
 */
public class OptionalErrorAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        SourceInfo source = instruction.source();
        IrInst operand = sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand());
        switch (instruction.tag()) {
            case IS_NULL:
                return sema.analyzeIsNull(block, source, operand, false);
            case IS_NON_NULL:
                return sema.analyzeIsNull(block, source, operand, true);
            case IS_ERR:
                return sema.analyzeIsErr(block, source, operand);
            case OPTIONAL_PAYLOAD_SAFE:
            case OPTIONAL_PAYLOAD_UNSAFE:
                return analyzeOptionalPayload(sema, block, source, operand,
                        instruction.tag() == Tag.OPTIONAL_PAYLOAD_SAFE);
            case ERR_UNION_PAYLOAD_SAFE:
            case ERR_UNION_PAYLOAD_UNSAFE:
                return analyzeErrUnionPayload(sema, block, source, operand,
                        instruction.tag() == Tag.ERR_UNION_PAYLOAD_SAFE);
            case ERR_UNION_CODE:
                return analyzeErrUnionCode(sema, block, source, operand);
            case ENSURE_ERR_PAYLOAD_VOID: {
                ErrorUnionType type = requireErrorUnion(sema, source, operand);
                if (type.payload().kind() != TypeKind.VOID) {
                    throw sema.fail(source, "expression value is ignored");
                }
                return sema.constVoid(block, source);
            }
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }

    private IrInst analyzeOptionalPayload(Sema sema, Block block, SourceInfo source, IrInst operand, boolean safe)
            throws SemanticException {
        if (!(operand.type() instanceof OptionalType optional)) {
            throw sema.fail(source, CompilerErrorCode.TYPE_MISMATCH, "expected optional type, found %s",
                    operand.type());
        }
        Value value = operand.value();
        if (value != null) {
            if (value.isNull()) {
                throw sema.fail(source, CompilerErrorCode.UNWRAP_NULL, "unable to unwrap null");
            }
            return sema.constInst(block, source, optional.child(), value);
        }
        Block b = sema.requireRuntimeBlock(block, source);
        if (safe && sema.wantSafety()) {
            IrInst isNonNull = b.add(new IrUnOp(IrTag.IS_NON_NULL, SimpleType.BOOL, operand, source));
            SafetyChecks.addSafetyCheck(b, isNonNull, SafetyChecks.PanicId.UNWRAP_NULL);
        }
        return b.add(new IrUnOp(IrTag.OPTIONAL_PAYLOAD, optional.child(), operand, source));
    }

    private IrInst analyzeErrUnionPayload(Sema sema, Block block, SourceInfo source, IrInst operand, boolean safe)
            throws SemanticException {
        ErrorUnionType type = requireErrorUnion(sema, source, operand);
        Value value = operand.value();
        if (value != null) {
            String error = Values.getError(value);
            if (error != null) {
                throw sema.fail(source, CompilerErrorCode.UNWRAP_ERROR, "caught unexpected error '%s'", error);
            }
            return sema.constInst(block, source, type.payload(), value);
        }
        Block b = sema.requireRuntimeBlock(block, source);
        if (safe && sema.wantSafety()) {
            IrInst isNonErr = b.add(new IrUnOp(IrTag.IS_NON_ERR, SimpleType.BOOL, operand, source));
            SafetyChecks.addSafetyCheck(b, isNonErr, SafetyChecks.PanicId.UNWRAP_ERRUNION);
        }
        return b.add(new IrUnOp(IrTag.UNWRAP_ERRUNION_PAYLOAD, type.payload(), operand, source));
    }

    private IrInst analyzeErrUnionCode(Sema sema, Block block, SourceInfo source, IrInst operand)
            throws SemanticException {
        ErrorUnionType type = requireErrorUnion(sema, source, operand);
        Value value = operand.value();
        if (value != null) {
            if (Values.getError(value) == null && !value.isUndef()) {
                throw sema.fail(source, CompilerErrorCode.TYPE_MISMATCH, "error union value '%s' holds no error",
                        value);
            }
            return sema.constInst(block, source, type.errorSet(), value);
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.UNWRAP_ERRUNION_ERR, type.errorSet(), operand, source));
    }

    private ErrorUnionType requireErrorUnion(Sema sema, SourceInfo source, IrInst operand) throws SemanticException {
        if (!(operand.type() instanceof ErrorUnionType type)) {
            throw sema.fail(source, CompilerErrorCode.TYPE_MISMATCH, "expected error union type, found '%s'",
                    operand.type());
        }
        return type;
    }
}
