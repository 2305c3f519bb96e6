package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;

public final class IrBinOp extends IrInst {

    private final IrInst lhs;
    private final IrInst rhs;

    public IrBinOp(IrTag tag, Type type, IrInst lhs, IrInst rhs, SourceInfo source) {
        super(tag, type, source);
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public IrInst lhs() {
        return lhs;
    }

    public IrInst rhs() {
        return rhs;
    }

    @Override
    public String toString() {
        return super.toString() + " (" + lhs + ", " + rhs + ")";
    }
}
