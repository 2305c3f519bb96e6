package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.ir.IrInst;

/**
 * Interface for the per-opcode handlers of semantic analysis.
 * Each handler is responsible for one or more untyped opcodes.
 */
@FunctionalInterface
public interface IInstructionHandler {
    /**
     * Analyzes a single untyped instruction.
     * @param sema The analysis driver, for resolution, coercion and diagnostics.
     * @param block The block the instruction appears in.
     * @param inst The index of the instruction in the block's untyped stream.
     * @return The typed result; a void constant for instructions without a value.
     * @throws SemanticException if the instruction is invalid.
     */
    IrInst analyze(Sema sema, Block block, int inst) throws SemanticException;
}
