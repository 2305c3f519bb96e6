package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.SimpleType;

/**
 * A break delivering a result to a block.
 * <p>
 * When the operand needs a coercion that emits instructions, the coercion body is attached and the
 * break becomes a {@link IrTag#BR_BLOCK_FLAT}: the body runs, then its result is delivered.
 */
public final class IrBr extends IrInst {

    private final IrBlock block;
    private IrInst operand;
    private IrBody coercionBody;

    public IrBr(IrBlock block, IrInst operand, SourceInfo source) {
        super(IrTag.BR, SimpleType.NO_RETURN, source);
        this.block = block;
        this.operand = operand;
    }

    public IrBlock block() {
        return block;
    }

    public IrInst operand() {
        return operand;
    }

    /**
     * @return The instructions computing the coerced operand, or {@code null}.
     */
    public IrBody coercionBody() {
        return coercionBody;
    }

    public void setOperand(IrInst operand) {
        this.operand = operand;
    }

    /**
     * Turns this break into a flat-block break.
     *
     * @param body    The coercion instructions.
     * @param operand The coerced result, the last instruction of {@code body}.
     */
    public void attachCoercion(IrBody body, IrInst operand) {
        this.coercionBody = body;
        this.operand = operand;
    }

    @Override
    public IrTag tag() {
        return coercionBody == null ? IrTag.BR : IrTag.BR_BLOCK_FLAT;
    }

    @Override
    public String toString() {
        return tag().name().toLowerCase() + " -> " + operand;
    }
}
