package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.SimpleType;

public final class IrCondBr extends IrInst {

    private final IrInst condition;
    private final IrBody thenBody;
    private final IrBody elseBody;

    public IrCondBr(IrInst condition, IrBody thenBody, IrBody elseBody, SourceInfo source) {
        super(IrTag.CONDBR, SimpleType.NO_RETURN, source);
        this.condition = condition;
        this.thenBody = thenBody;
        this.elseBody = elseBody;
    }

    public IrInst condition() {
        return condition;
    }

    public IrBody thenBody() {
        return thenBody;
    }

    public IrBody elseBody() {
        return elseBody;
    }
}
