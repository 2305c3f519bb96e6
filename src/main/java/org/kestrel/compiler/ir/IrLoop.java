package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.SimpleType;

/**
 * Repeats its body forever; the body leaves through a break to an enclosing block.
 */
public final class IrLoop extends IrInst {

    private final IrBody body;

    public IrLoop(IrBody body, SourceInfo source) {
        super(IrTag.LOOP, SimpleType.NO_RETURN, source);
        this.body = body;
    }

    public IrBody body() {
        return body;
    }
}
