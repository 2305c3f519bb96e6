package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;

import java.util.List;

/**
 * A runtime call.
 */
public final class IrCall extends IrInst {

    private final IrInst callee;
    private final List<IrInst> args;

    public IrCall(Type returnType, IrInst callee, List<IrInst> args, SourceInfo source) {
        super(IrTag.CALL, returnType, source);
        this.callee = callee;
        this.args = List.copyOf(args);
    }

    public IrInst callee() {
        return callee;
    }

    public List<IrInst> args() {
        return args;
    }
}
