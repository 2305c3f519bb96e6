package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.config.SemaConfig;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.diagnostics.DiagnosticsSink;
import org.kestrel.compiler.frontend.semantics.coercion.Coercion;
import org.kestrel.compiler.frontend.semantics.coercion.PeerTypeResolver;
import org.kestrel.compiler.frontend.semantics.eval.ComptimeArithmetic;
import org.kestrel.compiler.frontend.semantics.eval.NumericComparison;
import org.kestrel.compiler.frontend.semantics.switches.SwitchValidator;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrArg;
import org.kestrel.compiler.ir.IrBody;
import org.kestrel.compiler.ir.IrConstant;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.module.DeclarationRegistry;
import org.kestrel.compiler.module.Function;
import org.kestrel.compiler.module.SemaContext;
import org.kestrel.compiler.types.BoolValue;
import org.kestrel.compiler.types.DeclRefValue;
import org.kestrel.compiler.types.ErrorUnionType;
import org.kestrel.compiler.types.FnType;
import org.kestrel.compiler.types.IntValue;
import org.kestrel.compiler.types.PointerType;
import org.kestrel.compiler.types.OptionalType;
import org.kestrel.compiler.types.RefValue;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.SimpleValue;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.TypeValue;
import org.kestrel.compiler.types.TypedValue;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives semantic analysis: turns untyped instruction streams into typed IR.
 * <p>
 * The dispatcher walks a body in order, hands each instruction to the handler registered for its opcode
 * and records the result in the block's instruction map. The walk stops after the first result of type
 * {@code noreturn}; the rest of the body is unreachable and is not analyzed.
 * <p>
 * One instance serves a whole module. It holds no per-declaration state; that lives in {@link Block}s.
 */
public final class Sema {

    private static final IrConstant[] BUILTIN_INSTS = new IrConstant[Ref.BUILTIN_COUNT];

    static {
        for (int ref = Ref.NONE + 1; ref < Ref.BUILTIN_COUNT; ref++) {
            TypedValue tv = Ref.builtin(ref);
            BUILTIN_INSTS[ref] = new IrConstant(tv.type(), tv.value(), SourceInfo.UNKNOWN);
        }
    }

    private final SemaContext context;
    private final HandlerRegistry handlers;
    private final Coercion coercion;
    private final PeerTypeResolver peerTypes;
    private final ComptimeArithmetic arithmetic;
    private final NumericComparison numericComparison;
    private final SwitchValidator switchValidator;

    public Sema(SemaContext context, HandlerRegistry handlers) {
        this.context = context;
        this.handlers = handlers;
        this.coercion = new Coercion(this);
        this.peerTypes = new PeerTypeResolver(this);
        this.arithmetic = new ComptimeArithmetic(context.diagnostics());
        this.numericComparison = new NumericComparison(this);
        this.switchValidator = new SwitchValidator(context.diagnostics());
    }

    // region entry points

    /**
     * Evaluates the code of a declaration at compile time.
     *
     * @return The type and value of the last instruction of the root body.
     * @throws SemanticException if the code is invalid or its value is not compile-time-known.
     */
    public TypedValue analyzeDeclValue(Decl decl) throws SemanticException {
        UntypedCode code = decl.code();
        Block block = Block.forDeclValue(decl, code, new BranchQuota(config().defaultBranchQuota()));
        IrInst result = analyzeBody(block, code.rootBody());
        if (result == null) {
            throw new IllegalStateException("declaration '" + decl.name() + "' has an empty body");
        }
        Value value = resolveConstValue(result);
        return new TypedValue(result.type(), value);
    }

    /**
     * Analyzes the body of a runtime function.
     *
     * @return The typed body, starting with one {@code arg} instruction per parameter.
     * @throws SemanticException if the body is invalid.
     */
    public IrBody analyzeFnBody(Function function) throws SemanticException {
        FnType fnType = function.fnType();
        SourceInfo source = function.decl().source();
        List<IrInst> args = new ArrayList<>();
        for (int i = 0; i < fnType.paramTypes().size(); i++) {
            args.add(new IrArg(fnType.paramTypes().get(i), i, source));
        }
        Block block = Block.forFunctionBody(function, args, new BranchQuota(config().defaultBranchQuota()));
        for (IrInst arg : args) {
            block.add(arg);
        }
        analyzeBody(block, function.code().rootBody());
        IrInst last = block.lastInstruction();
        if (last == null || !last.isNoReturn()) {
            throw new IllegalStateException("body of function '" + function.name()
                    + "' does not end in a noreturn instruction");
        }
        return new IrBody(block.instructions());
    }

    // endregion

    // region dispatcher

    /**
     * Analyzes a body in order, stopping after the first {@code noreturn} result.
     *
     * @return The result of the last analyzed instruction, or {@code null} for an empty body.
     */
    public IrInst analyzeBody(Block block, int[] body) throws SemanticException {
        IrInst result = null;
        for (int index : body) {
            result = analyzeInst(block, index);
            block.instMap().put(index, result);
            if (result.isNoReturn()) {
                break;
            }
        }
        return result;
    }

    private IrInst analyzeInst(Block block, int index) throws SemanticException {
        UntypedInstruction inst = block.code().instruction(index);
        IrInst result = handlers.get(inst.tag()).analyze(this, block, index);
        if (CompilerLogger.isTraceEnabled()) {
            CompilerLogger.trace("%" + index + " " + inst.tag() + " -> " + result);
        }
        return result;
    }

    // endregion

    // region resolution

    /**
     * Resolves a stream reference: builtin constants first, then parameters (the coerced call arguments while
     * inlining), then already analyzed instructions.
     *
     * @throws IllegalStateException if the reference names nothing analyzed yet.
     */
    public IrInst resolveInst(Block block, int ref) {
        if (ref == Ref.NONE) {
            throw new IllegalStateException("missing operand");
        }
        if (Ref.isBuiltin(ref)) {
            return BUILTIN_INSTS[ref];
        }
        UntypedCode code = block.code();
        if (code.isParamRef(ref)) {
            int paramIndex = ref - Ref.BUILTIN_COUNT;
            Block.Inlining inlining = block.inlining();
            return inlining != null ? inlining.castedArgs().get(paramIndex) : block.params().get(paramIndex);
        }
        int index = code.refToIndex(ref);
        IrInst inst = block.instMap().get(index);
        if (inst == null) {
            throw new IllegalStateException("instruction %" + index + " referenced before it was analyzed");
        }
        return inst;
    }

    /**
     * Resolves a reference to a compile-time-known type.
     */
    public Type resolveType(Block block, int ref) throws SemanticException {
        IrInst coerced = coerce(block, SimpleType.TYPE, resolveInst(block, ref));
        return Values.toType(resolveConstValue(coerced));
    }

    /**
     * @return The value, or {@code null} if it is only known at run time.
     * @throws SemanticException if the value is undefined.
     */
    public Value resolveDefinedValue(IrInst inst) throws SemanticException {
        Value value = inst.value();
        if (value != null && value.isUndef()) {
            throw fail(inst.source(), CompilerErrorCode.UNDEFINED_VALUE,
                    "use of undefined value here causes undefined behavior");
        }
        return value;
    }

    /**
     * @return The compile-time-known, defined value.
     * @throws SemanticException if the value is only known at run time or is undefined.
     */
    public Value resolveConstValue(IrInst inst) throws SemanticException {
        Value value = resolveDefinedValue(inst);
        if (value == null) {
            throw fail(inst.source(), CompilerErrorCode.NOT_COMPTIME_KNOWN, "unable to resolve comptime value");
        }
        return value;
    }

    /**
     * Resolves a reference to a compile-time-known integer of the given type.
     */
    public BigInteger resolveInt(Block block, int ref, Type type) throws SemanticException {
        IrInst coerced = coerce(block, type, resolveInst(block, ref));
        return Values.toBigInteger(resolveConstValue(coerced));
    }

    /**
     * Resolves a reference to a compile-time-known string.
     */
    public String resolveConstString(Block block, int ref) throws SemanticException {
        IrInst coerced = coerce(block, Types.CONST_SLICE_U8, resolveInst(block, ref));
        Value value = resolveConstValue(coerced);
        String text = Values.toText(value);
        if (text == null) {
            throw new IllegalStateException("string value " + value + " has no bytes");
        }
        return text;
    }

    // endregion

    // region block requirements

    /**
     * @return The block, if it belongs to a runtime function.
     * @throws SemanticException at declaration level.
     */
    public Block requireFunctionBlock(Block block, SourceInfo source) throws SemanticException {
        if (block.function() == null) {
            throw fail(source, "instruction illegal outside function body");
        }
        return block;
    }

    /**
     * @return The block, if runtime instructions may be emitted into it.
     * @throws SemanticException if the block is evaluated at compile time or lies at declaration level.
     */
    public Block requireRuntimeBlock(Block block, SourceInfo source) throws SemanticException {
        if (block.isComptime()) {
            throw fail(source, CompilerErrorCode.NOT_COMPTIME_KNOWN, "unable to resolve comptime value");
        }
        return requireFunctionBlock(block, source);
    }

    // endregion

    // region constants

    public IrConstant constInst(Block block, SourceInfo source, Type type, Value value) {
        return block.arena().add(new IrConstant(type, value, source));
    }

    public IrConstant constType(Block block, SourceInfo source, Type type) {
        return constInst(block, source, SimpleType.TYPE, new TypeValue(type));
    }

    public IrConstant constVoid(Block block, SourceInfo source) {
        return constInst(block, source, SimpleType.VOID, SimpleValue.VOID);
    }

    public IrConstant constUndef(Block block, SourceInfo source, Type type) {
        return constInst(block, source, type, SimpleValue.UNDEF);
    }

    public IrConstant constBool(Block block, SourceInfo source, boolean value) {
        return constInst(block, source, SimpleType.BOOL, BoolValue.of(value));
    }

    public IrConstant constInt(Block block, SourceInfo source, Type type, BigInteger value) {
        return constInst(block, source, type, new IntValue(value));
    }

    /**
     * @return The result of a branch that was resolved at compile time; nothing after it is analyzed.
     */
    public IrConstant constNoReturn(Block block, SourceInfo source) {
        return constInst(block, source, SimpleType.NO_RETURN, SimpleValue.UNREACHABLE);
    }

    // endregion

    // region declarations and pointers

    /**
     * References a declaration from the block's owner, analyzing it first if needed.
     *
     * @return A compile-time-known pointer to the declaration's value.
     */
    public IrInst analyzeDeclRef(Block block, SourceInfo source, Decl decl) throws SemanticException {
        DeclarationRegistry declarations = context.declarations();
        if (decl != block.owner()) {
            declarations.declareDependency(block.owner(), decl);
        }
        TypedValue typedValue = declarations.ensureAnalyzed(decl);
        PointerType ptrType = Types.simplePtrType(typedValue.type(), false, PointerType.Size.ONE);
        return constInst(block, source, ptrType, new DeclRefValue(decl));
    }

    /**
     * Loads through a pointer; folds when the pointer is compile-time-known.
     */
    public IrInst analyzeDeref(Block block, SourceInfo source, IrInst ptr) throws SemanticException {
        if (!(ptr.type() instanceof PointerType ptrType)) {
            throw fail(ptr.source(), CompilerErrorCode.TYPE_MISMATCH, "expected pointer, found '%s'", ptr.type());
        }
        Value ptrValue = ptr.value();
        if (ptrValue != null) {
            return constInst(block, source, ptrType.elem(), Values.pointerDeref(ptrValue));
        }
        Block b = requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.LOAD, ptrType.elem(), ptr, source));
    }

    /**
     * Takes the address of a value; a compile-time-known value yields a compile-time-known pointer.
     */
    public IrInst analyzeRef(Block block, SourceInfo source, IrInst operand) throws SemanticException {
        PointerType ptrType = Types.simplePtrType(operand.type(), false, PointerType.Size.ONE);
        Value value = operand.value();
        if (value != null) {
            return constInst(block, source, ptrType, new RefValue(value));
        }
        Block b = requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.REF, ptrType, operand, source));
    }

    /**
     * Tests an optional for null; folds when the operand is compile-time-known.
     *
     * @param invert {@code true} to test for non-null instead.
     */
    public IrInst analyzeIsNull(Block block, SourceInfo source, IrInst operand, boolean invert)
            throws SemanticException {
        Type type = operand.type();
        if (type.kind() == TypeKind.NULL) {
            return constBool(block, source, !invert);
        }
        if (!(type instanceof OptionalType)) {
            return constBool(block, source, invert);
        }
        Value value = operand.value();
        if (value != null) {
            if (value.isUndef()) {
                return constUndef(block, source, SimpleType.BOOL);
            }
            return constBool(block, source, value.isNull() != invert);
        }
        Block b = requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(invert ? IrTag.IS_NON_NULL : IrTag.IS_NULL, SimpleType.BOOL, operand, source));
    }

    /**
     * Tests an error union for an error; folds when the operand is compile-time-known.
     */
    public IrInst analyzeIsErr(Block block, SourceInfo source, IrInst operand) throws SemanticException {
        Type type = operand.type();
        if (type.kind() == TypeKind.ERROR_SET) {
            return constBool(block, source, true);
        }
        if (!(type instanceof ErrorUnionType)) {
            return constBool(block, source, false);
        }
        Value value = operand.value();
        if (value != null) {
            if (value.isUndef()) {
                return constUndef(block, source, SimpleType.BOOL);
            }
            return constBool(block, source, Values.getError(value) != null);
        }
        Block b = requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.IS_ERR, SimpleType.BOOL, operand, source));
    }

    /**
     * Counts a backward branch against the shared quota when evaluating inlined code.
     */
    public void emitBackwardBranch(Block block, SourceInfo source) throws SemanticException {
        block.quota().emitBackwardBranch(context.diagnostics(), source);
    }

    // endregion

    // region coercion

    /**
     * Converts a value to the destination type.
     *
     * @throws SemanticException if no coercion rule applies.
     */
    public IrInst coerce(Block block, Type dest, IrInst inst) throws SemanticException {
        return coercion.coerce(block, dest, inst);
    }

    /**
     * @return The common type of the instructions.
     * @throws SemanticException if two of them have incompatible types.
     */
    public Type resolvePeerTypes(Block block, List<IrInst> insts) throws SemanticException {
        return peerTypes.resolve(insts);
    }

    /**
     * Reinterprets a value as another type of the same representation.
     */
    public IrInst bitcast(Block block, Type dest, IrInst inst) throws SemanticException {
        return coercion.bitcast(block, dest, inst);
    }

    public ComptimeArithmetic arithmetic() {
        return arithmetic;
    }

    public NumericComparison numericComparison() {
        return numericComparison;
    }

    public SwitchValidator switchValidator() {
        return switchValidator;
    }

    // endregion

    // region diagnostics

    public SemanticException fail(SourceInfo source, CompilerErrorCode code, String format, Object... args) {
        return context.diagnostics().fail(source, code, format, args);
    }

    public SemanticException fail(SourceInfo source, String format, Object... args) {
        return context.diagnostics().fail(source, format, args);
    }

    // endregion

    public SemaContext context() {
        return context;
    }

    public DiagnosticsSink diagnostics() {
        return context.diagnostics();
    }

    public SemaConfig config() {
        return context.config();
    }

    public boolean wantSafety() {
        return context.config().wantSafety();
    }
}
