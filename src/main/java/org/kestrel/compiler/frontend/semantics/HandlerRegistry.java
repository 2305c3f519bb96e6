package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.frontend.semantics.analysis.ArithmeticAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.BlockAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.CallAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.CastAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.ComparisonAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.ConstantAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.DebugAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.DeclAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.MemoryAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.OptionalErrorAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.SwitchAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.TypeAnalysisHandler;
import org.kestrel.compiler.frontend.untyped.Tag;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping untyped opcodes to their {@link IInstructionHandler}s.
 * <p>
 * The mapping must be total: {@link #initializeWithDefaults()} registers a handler for every {@link Tag}
 * and refuses to return an incomplete registry.
 */
public final class HandlerRegistry {

    private final Map<Tag, IInstructionHandler> byTag = new EnumMap<>(Tag.class);

    /**
     * Registers a handler for an opcode, replacing any earlier one.
     *
     * @param tag     The opcode.
     * @param handler The handler analyzing it.
     */
    public void register(Tag tag, IInstructionHandler handler) {
        byTag.put(tag, handler);
    }

    /**
     * Registers one handler for several opcodes.
     */
    public void registerAll(Set<Tag> tags, IInstructionHandler handler) {
        for (Tag tag : tags) {
            register(tag, handler);
        }
    }

    /**
     * @param tag The opcode to look up.
     * @return The registered handler.
     * @throws IllegalStateException if no handler is registered for the opcode.
     */
    public IInstructionHandler get(Tag tag) {
        IInstructionHandler handler = byTag.get(tag);
        if (handler == null) {
            throw new IllegalStateException("no handler registered for opcode " + tag);
        }
        return handler;
    }

    /**
     * @return The opcodes without a handler.
     */
    public Set<Tag> missingTags() {
        Set<Tag> missing = EnumSet.allOf(Tag.class);
        missing.removeAll(byTag.keySet());
        return missing;
    }

    /**
     * Creates an empty registry. Handlers can be registered by callers after construction.
     *
     * @return A new, empty registry.
     */
    public static HandlerRegistry initialize() {
        return new HandlerRegistry();
    }

    /**
     * Initializes a registry with the handlers for the complete instruction set.
     *
     * @return A registry with a handler for every opcode.
     * @throws IllegalStateException if an opcode was left without a handler.
     */
    public static HandlerRegistry initializeWithDefaults() {
        HandlerRegistry reg = initialize();
        reg.registerAll(EnumSet.range(Tag.INT, Tag.VOID_VALUE), new ConstantAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.INT_TYPE, Tag.TYPEOF_PEER), new TypeAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.DECL_REF, Tag.IMPORT), new DeclAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.BLOCK, Tag.CONDBR), new BlockAnalysisHandler());
        reg.registerAll(EnumSet.of(Tag.SWITCHBR, Tag.SWITCHBR_REF), new SwitchAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.CALL, Tag.RET), new CallAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.ADD, Tag.SHR), new ArithmeticAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.CMP_LT, Tag.BOOL_OR), new ComparisonAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.AS, Tag.BITCAST), new CastAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.IS_NULL, Tag.ENSURE_ERR_PAYLOAD_VOID), new OptionalErrorAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.ALLOC, Tag.ELEM_VAL), new MemoryAnalysisHandler());
        reg.registerAll(EnumSet.range(Tag.ENSURE_RESULT_USED, Tag.SET_EVAL_BRANCH_QUOTA), new DebugAnalysisHandler());
        Set<Tag> missing = reg.missingTags();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("opcodes without handler: " + missing);
        }
        return reg;
    }
}
