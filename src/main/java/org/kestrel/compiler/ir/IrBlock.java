package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;

/**
 * A merge point: breaks targeting this block deliver its result.
 * <p>
 * The type and body are set once all breaks are known.
 */
public final class IrBlock extends IrInst {

    private IrBody body = IrBody.EMPTY;

    public IrBlock(Type type, SourceInfo source) {
        super(IrTag.BLOCK, type, source);
    }

    public IrBody body() {
        return body;
    }

    public void setBody(IrBody body) {
        this.body = body;
    }

    public void setType(Type type) {
        this.type = type;
    }
}
