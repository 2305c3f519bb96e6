package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.types.ArrayType;
import org.kestrel.compiler.types.CallingConvention;
import org.kestrel.compiler.types.EnumLiteralValue;
import org.kestrel.compiler.types.ErrorSetType;
import org.kestrel.compiler.types.ErrorUnionType;
import org.kestrel.compiler.types.ErrorValue;
import org.kestrel.compiler.types.FnType;
import org.kestrel.compiler.types.IntType;
import org.kestrel.compiler.types.OptionalType;
import org.kestrel.compiler.types.PointerType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Handles the semantic analysis of type-constructing instructions.
 * Every operand must be compile-time-known; the result is a {@code type} constant.
 */
public class TypeAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        SourceInfo source = instruction.source();
        switch (instruction.tag()) {
            case INT_TYPE: {
                InstData.IntType data = instruction.data(InstData.IntType.class);
                return sema.constType(block, source, new IntType(data.signedness(), data.bits()));
            }
            case OPTIONAL_TYPE: {
                Type child = sema.resolveType(block, instruction.data(InstData.UnNode.class).operand());
                return sema.constType(block, source, new OptionalType(child));
            }
            case ARRAY_TYPE: {
                InstData.Bin bin = instruction.data(InstData.Bin.class);
                long len = sema.resolveInt(block, bin.lhs(), Types.USIZE).longValueExact();
                Type elem = sema.resolveType(block, bin.rhs());
                return sema.constType(block, source, new ArrayType(len, elem, null));
            }
            case ARRAY_TYPE_SENTINEL:
                return analyzeArrayTypeSentinel(sema, block, instruction);
            case PTR_TYPE_SIMPLE: {
                InstData.PtrTypeSimple data = instruction.data(InstData.PtrTypeSimple.class);
                Type elem = sema.resolveType(block, data.elemType());
                return sema.constType(block, source, new PointerType(data.size(), elem, data.mutable(),
                        data.isVolatile(), data.allowZero(), null));
            }
            case ERROR_UNION_TYPE: {
                InstData.Bin bin = instruction.data(InstData.Bin.class);
                Type errorSet = resolveErrorSet(sema, block, bin.lhs());
                Type payload = sema.resolveType(block, bin.rhs());
                return sema.constType(block, source, new ErrorUnionType(errorSet, payload));
            }
            case ERROR_SET:
                return analyzeErrorSet(sema, block, instruction);
            case ERROR_VALUE: {
                String name = block.code().string(instruction.data(InstData.Str.class));
                sema.context().errors().internError(name);
                return sema.constInst(block, source, ErrorSetType.single(name), new ErrorValue(name));
            }
            case MERGE_ERROR_SETS:
                return analyzeMergeErrorSets(sema, block, instruction);
            case FN_TYPE:
            case FN_TYPE_CC:
                return analyzeFnType(sema, block, instruction);
            case PARAM_TYPE:
                return analyzeParamType(sema, block, instruction);
            case TYPEOF: {
                IrInst operand = sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand());
                return sema.constType(block, source, operand.type());
            }
            case TYPEOF_PEER: {
                int[] operands = block.code().readMultiOp(instruction.data(InstData.PlNode.class).payloadIndex());
                List<IrInst> insts = new ArrayList<>(operands.length);
                for (int ref : operands) {
                    insts.add(sema.resolveInst(block, ref));
                }
                return sema.constType(block, source, sema.resolvePeerTypes(block, insts));
            }
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }

    private IrInst analyzeArrayTypeSentinel(Sema sema, Block block, UntypedInstruction instruction)
            throws SemanticException {
        UntypedCode.ArrayTypeSentinel payload =
                block.code().readArrayTypeSentinel(instruction.data(InstData.PlNode.class).payloadIndex());
        long len = sema.resolveInt(block, payload.len(), Types.USIZE).longValueExact();
        Type elem = sema.resolveType(block, payload.elemType());
        IrInst sentinel = sema.coerce(block, elem, sema.resolveInst(block, payload.sentinel()));
        Value sentinelValue = sema.resolveConstValue(sentinel);
        return sema.constType(block, instruction.source(), new ArrayType(len, elem, sentinelValue));
    }

    private IrInst analyzeErrorSet(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        List<String> names = block.code().readErrorSet(instruction.data(InstData.PlNode.class).payloadIndex());
        Set<String> seen = new LinkedHashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw sema.fail(instruction.source(), "duplicate error: '%s'", name);
            }
            sema.context().errors().internError(name);
        }
        return sema.constType(block, instruction.source(), new ErrorSetType(new ArrayList<>(seen)));
    }

    private IrInst analyzeMergeErrorSets(Sema sema, Block block, UntypedInstruction instruction)
            throws SemanticException {
        InstData.Bin bin = instruction.data(InstData.Bin.class);
        Type lhs = resolveErrorSet(sema, block, bin.lhs());
        Type rhs = resolveErrorSet(sema, block, bin.rhs());
        if (lhs == SimpleType.ANYERROR || rhs == SimpleType.ANYERROR) {
            return sema.constType(block, instruction.source(), SimpleType.ANYERROR);
        }
        Set<String> names = new TreeSet<>(((ErrorSetType) lhs).names());
        names.addAll(((ErrorSetType) rhs).names());
        return sema.constType(block, instruction.source(), new ErrorSetType(new ArrayList<>(names)));
    }

    private Type resolveErrorSet(Sema sema, Block block, int ref) throws SemanticException {
        Type type = sema.resolveType(block, ref);
        if (type.kind() != TypeKind.ERROR_SET) {
            throw sema.fail(sema.resolveInst(block, ref).source(), CompilerErrorCode.TYPE_MISMATCH,
                    "expected error set type, found %s", type);
        }
        return type;
    }

    private IrInst analyzeFnType(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        UntypedCode.FnTypePayload payload =
                block.code().readFnType(instruction.data(InstData.PlNode.class).payloadIndex());
        CallingConvention cc = CallingConvention.UNSPECIFIED;
        if (payload.cc() != Ref.NONE) {
            IrInst ccInst = sema.coerce(block, SimpleType.ENUM_LITERAL, sema.resolveInst(block, payload.cc()));
            String name = ((EnumLiteralValue) sema.resolveConstValue(ccInst)).name();
            cc = CallingConvention.fromSourceName(name).orElse(null);
            if (cc == null) {
                throw sema.fail(ccInst.source(), "Unknown calling convention %s", name);
            }
        }
        Type returnType = sema.resolveType(block, payload.returnType());
        List<Type> paramTypes = new ArrayList<>(payload.paramTypes().length);
        for (int ref : payload.paramTypes()) {
            paramTypes.add(sema.resolveType(block, ref));
        }
        return sema.constType(block, instruction.source(), new FnType(paramTypes, returnType, cc, payload.varArgs()));
    }

    private IrInst analyzeParamType(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        InstData.ParamType data = instruction.data(InstData.ParamType.class);
        IrInst callee = sema.resolveInst(block, data.callee());
        if (!(callee.type() instanceof FnType fnType)) {
            throw sema.fail(instruction.source(), CompilerErrorCode.NOT_CALLABLE,
                    "expected function, found '%s'", callee.type());
        }
        int paramCount = fnType.paramTypes().size();
        if (data.paramIndex() >= paramCount) {
            if (fnType.varArgs()) {
                return sema.constType(block, instruction.source(), SimpleType.VAR_ARGS_PARAM);
            }
            throw sema.fail(instruction.source(), CompilerErrorCode.WRONG_ARGUMENT_COUNT,
                    "arg index %d out of bounds; '%s' has %d argument(s)", data.paramIndex(), fnType, paramCount);
        }
        return sema.constType(block, instruction.source(), fnType.paramTypes().get(data.paramIndex()));
    }
}
