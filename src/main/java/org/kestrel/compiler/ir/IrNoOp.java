package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;

/**
 * An instruction without operands.
 */
public final class IrNoOp extends IrInst {

    public IrNoOp(IrTag tag, Type type, SourceInfo source) {
        super(tag, type, source);
    }
}
