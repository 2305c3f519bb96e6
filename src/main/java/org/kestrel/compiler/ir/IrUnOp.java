package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;

public final class IrUnOp extends IrInst {

    private final IrInst operand;

    public IrUnOp(IrTag tag, Type type, IrInst operand, SourceInfo source) {
        super(tag, type, source);
        this.operand = operand;
    }

    public IrInst operand() {
        return operand;
    }

    @Override
    public String toString() {
        return super.toString() + " (" + operand + ")";
    }
}
