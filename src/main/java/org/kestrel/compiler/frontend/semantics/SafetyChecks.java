package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.ir.IrBlock;
import org.kestrel.compiler.ir.IrBody;
import org.kestrel.compiler.ir.IrBrVoid;
import org.kestrel.compiler.ir.IrCondBr;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrNoOp;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.types.SimpleType;

import java.util.List;

/**
 * Lowers runtime safety checks.
 * <p>
 * A check is a {@code void} block holding {@code condbr(ok, { br_void block }, { breakpoint; unreach })}.
 */
public final class SafetyChecks {

    /**
     * The failure a panic reports.
     */
    public enum PanicId {
        UNREACH,
        UNWRAP_NULL,
        UNWRAP_ERRUNION
    }

    private SafetyChecks() {}

    /**
     * Appends a check that panics unless {@code ok} is true.
     *
     * @param block The runtime block to append to.
     * @param ok    The {@code bool} condition under which execution continues.
     * @param panicId The failure reported otherwise.
     */
    public static void addSafetyCheck(Block block, IrInst ok, PanicId panicId) {
        SourceInfo source = ok.source();
        IrBlock checkBlock = new IrBlock(SimpleType.VOID, source);

        Block failBlock = block.makeSubBlock();
        panic(failBlock, source, panicId);

        Block okBlock = block.makeSubBlock();
        okBlock.add(new IrBrVoid(checkBlock, source));

        IrCondBr condBr = block.arena().add(new IrCondBr(ok, new IrBody(okBlock.instructions()),
                new IrBody(failBlock.instructions()), source));
        checkBlock.setBody(new IrBody(List.of(condBr)));
        block.add(checkBlock);
        CompilerLogger.trace("safety check {} at {}", panicId, source);
    }

    /**
     * Appends an unconditional panic.
     *
     * @return The terminating {@code unreach}.
     */
    public static IrInst panic(Block block, SourceInfo source, PanicId panicId) {
        // Trap until a panic handler exists to call with the panic id.
        block.add(new IrNoOp(IrTag.BREAKPOINT, SimpleType.VOID, source));
        return block.add(new IrNoOp(IrTag.UNREACH, SimpleType.NO_RETURN, source));
    }
}
