package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.ir.IrBlock;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.module.Arena;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.module.FileScope;
import org.kestrel.compiler.module.Function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A lexical scope under analysis: collects the typed instructions of one body.
 * <p>
 * Child blocks share the instruction map, arena and inlining state of their parent. A labeled
 * block is the target of breaks; an inline-call block has no parent, so breaks and returns in
 * the callee cannot reach the caller's labels.
 */
public final class Block {

    /**
     * Break target state of a structured block.
     *
     * @param untypedIndex The untyped block instruction breaks refer to.
     * @param merges       The collected breaks.
     */
    public record Label(int untypedIndex, BlockMerge merges) {}

    /**
     * State of a callee body being evaluated in place of a runtime call.
     *
     * @param callee     The function being inlined.
     * @param castedArgs The arguments, already coerced to the parameter types; they stand in for parameter refs.
     * @param merges     Returns of the callee, treated as breaks to the call's result block.
     */
    public record Inlining(Function callee, List<IrInst> castedArgs, BlockMerge merges) {}

    private final Block parent;
    private final Decl owner;
    private final Function function;
    private final UntypedCode code;
    private final List<IrInst> params;
    private final InstMap instMap;
    private final Arena arena;
    private final Inlining inlining;
    private final BranchQuota quota;
    private final boolean isComptime;
    private final Label label;
    private final List<IrInst> instructions = new ArrayList<>();

    private Block(Block parent, Decl owner, Function function, UntypedCode code, List<IrInst> params,
                  InstMap instMap, Arena arena, Inlining inlining, BranchQuota quota, boolean isComptime,
                  Label label) {
        this.parent = parent;
        this.owner = owner;
        this.function = function;
        this.code = code;
        this.params = params;
        this.instMap = instMap;
        this.arena = arena;
        this.inlining = inlining;
        this.quota = quota;
        this.isComptime = isComptime;
        this.label = label;
    }

    /**
     * Creates the outermost block of a declaration value; it is always evaluated at compile time.
     */
    public static Block forDeclValue(Decl owner, UntypedCode code, BranchQuota quota) {
        return new Block(null, owner, null, code, List.of(), new InstMap(), owner.arena(), null, quota, true, null);
    }

    /**
     * Creates the outermost block of a runtime function body.
     *
     * @param params The typed parameter instructions.
     */
    public static Block forFunctionBody(Function function, List<IrInst> params, BranchQuota quota) {
        Decl owner = function.decl();
        return new Block(null, owner, function, function.code(), List.copyOf(params), new InstMap(),
                owner.arena(), null, quota, false, null);
    }

    /**
     * Creates the block an inlined callee body is analyzed in. It allocates from the caller's arena
     * and draws on the caller's branch quota.
     */
    public static Block forInlineCall(Block caller, Inlining inlining, boolean isComptime) {
        return new Block(null, caller.owner, caller.function, inlining.callee().code(), List.of(), new InstMap(),
                caller.arena, inlining, caller.quota, isComptime, null);
    }

    /**
     * @return A child block sharing this block's state, without label.
     */
    public Block makeSubBlock() {
        return new Block(this, owner, function, code, params, instMap, arena, inlining, quota, isComptime, null);
    }

    /**
     * @param forceComptime {@code true} to force compile-time evaluation of the child.
     * @return A labeled child block for a structured block instruction.
     */
    public Block makeLabeledChild(int untypedIndex, IrBlock blockInst, boolean forceComptime) {
        Label childLabel = new Label(untypedIndex, new BlockMerge(blockInst));
        return new Block(this, owner, function, code, params, instMap, arena, inlining, quota,
                isComptime || forceComptime, childLabel);
    }

    /**
     * @return A child block like {@link #makeSubBlock()}, optionally forced to compile time.
     */
    public Block makeSubBlock(boolean forceComptime) {
        return new Block(this, owner, function, code, params, instMap, arena, inlining, quota,
                isComptime || forceComptime, null);
    }

    /**
     * Appends an instruction and hands it to the arena.
     */
    public <T extends IrInst> T add(T inst) {
        arena.add(inst);
        instructions.add(inst);
        return inst;
    }

    /**
     * Appends instructions that a child block already handed to the arena.
     */
    public void splice(List<IrInst> insts) {
        instructions.addAll(insts);
    }

    /**
     * Walks this block and its ancestors for the label of an untyped block instruction.
     *
     * @return The label, or {@code null}.
     */
    public Label findLabel(int untypedIndex) {
        for (Block b = this; b != null; b = b.parent) {
            if (b.label != null && b.label.untypedIndex() == untypedIndex) {
                return b.label;
            }
        }
        return null;
    }

    public Block parent() {
        return parent;
    }

    public Decl owner() {
        return owner;
    }

    /**
     * @return The runtime function being analyzed, or {@code null} at declaration level.
     */
    public Function function() {
        return function;
    }

    public UntypedCode code() {
        return code;
    }

    public List<IrInst> params() {
        return params;
    }

    public InstMap instMap() {
        return instMap;
    }

    public Arena arena() {
        return arena;
    }

    /**
     * @return The inlining state, or {@code null} outside inline calls.
     */
    public Inlining inlining() {
        return inlining;
    }

    /**
     * @return The backward-branch budget shared by this analysis and every call inlined into it.
     */
    public BranchQuota quota() {
        return quota;
    }

    /**
     * @return The file whose declarations names in the current code refer to.
     */
    public FileScope fileScope() {
        return inlining != null ? inlining.callee().decl().scope() : owner.scope();
    }

    public boolean isComptime() {
        return isComptime;
    }

    public Label label() {
        return label;
    }

    public List<IrInst> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    public IrInst lastInstruction() {
        return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
    }
}
