package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.SimpleType;

public final class IrBrVoid extends IrInst {

    private final IrBlock block;

    public IrBrVoid(IrBlock block, SourceInfo source) {
        super(IrTag.BR_VOID, SimpleType.NO_RETURN, source);
        this.block = block;
    }

    public IrBlock block() {
        return block;
    }
}
