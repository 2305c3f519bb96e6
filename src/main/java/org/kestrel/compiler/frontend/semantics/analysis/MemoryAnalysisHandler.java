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
import org.kestrel.compiler.ir.IrNoOp;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.types.ArrayType;
import org.kestrel.compiler.types.ElemPtrValue;
import org.kestrel.compiler.types.ErrorSetType;
import org.kestrel.compiler.types.ErrorValue;
import org.kestrel.compiler.types.PointerType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.StructType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Handles the semantic analysis of allocations, loads, stores, and field and element access.
 * <p>
 * Value access is lowered to pointer access: {@code field_val} takes a reference, resolves the field
 * pointer and loads through it; {@code elem_val} does the same with an element pointer.
 */
public class MemoryAnalysisHandler implements IInstructionHandler {

    private static final String LEN = "len";

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        SourceInfo source = instruction.source();
        switch (instruction.tag()) {
            case ALLOC:
            case ALLOC_MUT:
                return analyzeAlloc(sema, block, instruction);
            case STORE: {
                InstData.Bin bin = instruction.data(InstData.Bin.class);
                return analyzeStore(sema, block, source, sema.resolveInst(block, bin.lhs()),
                        sema.resolveInst(block, bin.rhs()));
            }
            case REF:
                return sema.analyzeRef(block, source,
                        sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand()));
            case DEREF:
                return sema.analyzeDeref(block, source,
                        sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand()));
            case FIELD_PTR:
            case FIELD_VAL: {
                InstData.StrOp data = instruction.data(InstData.StrOp.class);
                String name = block.code().string(data);
                IrInst operand = sema.resolveInst(block, data.operand());
                if (instruction.tag() == Tag.FIELD_PTR) {
                    return analyzeFieldPtr(sema, block, source, operand, name);
                }
                IrInst ptr = sema.analyzeRef(block, source, operand);
                return sema.analyzeDeref(block, source, analyzeFieldPtr(sema, block, source, ptr, name));
            }
            case ELEM_PTR:
            case ELEM_VAL: {
                InstData.Bin bin = instruction.data(InstData.Bin.class);
                IrInst elemPtr = analyzeElemPtr(sema, block, source, sema.resolveInst(block, bin.lhs()),
                        sema.resolveInst(block, bin.rhs()));
                return instruction.tag() == Tag.ELEM_PTR ? elemPtr : sema.analyzeDeref(block, source, elemPtr);
            }
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }

    private IrInst analyzeAlloc(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        SourceInfo source = instruction.source();
        Type varType = sema.resolveType(block, instruction.data(InstData.UnNode.class).operand());
        if (instruction.tag() == Tag.ALLOC_MUT && Types.requiresComptime(varType)) {
            throw sema.fail(source, CompilerErrorCode.TYPE_MISMATCH,
                    "variable of type '%s' must be const or comptime", varType);
        }
        PointerType ptrType = Types.simplePtrType(varType, true, PointerType.Size.ONE);
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrNoOp(IrTag.ALLOC, ptrType, source));
    }

    private IrInst analyzeStore(Sema sema, Block block, SourceInfo source, IrInst ptr, IrInst value)
            throws SemanticException {
        if (!(ptr.type() instanceof PointerType ptrType)) {
            throw sema.fail(ptr.source(), CompilerErrorCode.TYPE_MISMATCH, "expected pointer, found '%s'", ptr.type());
        }
        if (ptrType.isConst()) {
            throw sema.fail(source, "cannot assign to constant");
        }
        IrInst coerced = sema.coerce(block, ptrType.elem(), value);
        if (Types.hasOnePossibleValue(ptrType.elem())) {
            return sema.constVoid(block, source);
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrBinOp(IrTag.STORE, SimpleType.VOID, ptr, coerced, source));
    }

    private IrInst analyzeFieldPtr(Sema sema, Block block, SourceInfo source, IrInst ptr, String name)
            throws SemanticException {
        if (!(ptr.type() instanceof PointerType ptrType)) {
            throw sema.fail(ptr.source(), CompilerErrorCode.TYPE_MISMATCH, "expected pointer, found '%s'", ptr.type());
        }
        Type elem = ptrType.elem();
        ArrayType array = arrayBehind(elem);
        if (array != null) {
            if (!LEN.equals(name)) {
                throw sema.fail(source, CompilerErrorCode.INVALID_FIELD_ACCESS, "no member named '%s' in '%s'",
                        name, elem);
            }
            IrInst len = sema.constInt(block, source, Types.USIZE, BigInteger.valueOf(array.len()));
            return sema.analyzeRef(block, source, len);
        }
        if (elem.kind() == TypeKind.TYPE) {
            Type container = Values.toType(sema.resolveConstValue(sema.analyzeDeref(block, source, ptr)));
            return analyzeContainerMember(sema, block, source, container, name);
        }
        throw sema.fail(source, CompilerErrorCode.INVALID_FIELD_ACCESS, "type '%s' does not support field access",
                elem);
    }

    private IrInst analyzeContainerMember(Sema sema, Block block, SourceInfo source, Type container, String name)
            throws SemanticException {
        if (container.kind() == TypeKind.ERROR_SET) {
            if (container != SimpleType.ANYERROR && !((ErrorSetType) container).contains(name)) {
                throw sema.fail(source, CompilerErrorCode.INVALID_FIELD_ACCESS, "no error named '%s' in '%s'",
                        name, container);
            }
            sema.context().errors().internError(name);
            Type errorType = container == SimpleType.ANYERROR ? ErrorSetType.single(name) : container;
            IrInst error = sema.constInst(block, source, errorType, new ErrorValue(name));
            return sema.analyzeRef(block, source, error);
        }
        if (container instanceof StructType struct) {
            Optional<Decl> decl = struct.namespace().lookupDecl(name);
            if (decl.isEmpty()) {
                throw sema.fail(source, CompilerErrorCode.INVALID_FIELD_ACCESS,
                        "container '%s' has no member called '%s'", container, name);
            }
            return sema.analyzeDeclRef(block, source, decl.get());
        }
        throw sema.fail(source, CompilerErrorCode.INVALID_FIELD_ACCESS, "type '%s' does not support field access",
                container);
    }

    private IrInst analyzeElemPtr(Sema sema, Block block, SourceInfo source, IrInst ptr, IrInst index)
            throws SemanticException {
        if (!(ptr.type() instanceof PointerType ptrType)) {
            throw sema.fail(ptr.source(), CompilerErrorCode.TYPE_MISMATCH, "expected pointer, found '%s'", ptr.type());
        }
        ArrayType array = ptrType.isSingle() && ptrType.elem() instanceof ArrayType at ? at : null;
        Type elemType;
        if (array != null) {
            elemType = array.elem();
        } else if (!ptrType.isSingle()) {
            elemType = ptrType.elem();
        } else {
            throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS, "array access of non-array type '%s'",
                    ptrType.elem());
        }
        IrInst castedIndex = sema.coerce(block, Types.USIZE, index);

        Value ptrValue = ptr.value();
        Value indexValue = sema.resolveDefinedValue(castedIndex);
        if (array != null && ptrValue != null && indexValue != null) {
            BigInteger i = Values.toBigInteger(indexValue);
            long limit = array.sentinel() != null ? array.len() + 1 : array.len();
            if (i.compareTo(BigInteger.valueOf(limit)) >= 0) {
                throw sema.fail(castedIndex.source(), CompilerErrorCode.VALUE_DOES_NOT_FIT,
                        "index %d outside array of length %d", i, array.len());
            }
            PointerType elemPtrType = Types.simplePtrType(elemType, false, PointerType.Size.ONE);
            return sema.constInst(block, source, elemPtrType, new ElemPtrValue(ptrValue, i.longValue()));
        }
        Block b = sema.requireRuntimeBlock(block, source);
        PointerType elemPtrType = Types.simplePtrType(elemType, ptrType.mutable(), PointerType.Size.ONE);
        return b.add(new IrBinOp(IrTag.ELEM_PTR, elemPtrType, ptr, castedIndex, source));
    }

    private static ArrayType arrayBehind(Type type) {
        if (type instanceof ArrayType array) {
            return array;
        }
        if (type instanceof PointerType ptr && ptr.isSingle() && ptr.elem() instanceof ArrayType array) {
            return array;
        }
        return null;
    }
}
