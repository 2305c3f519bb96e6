package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;

/**
 * A runtime parameter of the function being analyzed.
 */
public final class IrArg extends IrInst {

    private final int index;

    public IrArg(Type type, int index, SourceInfo source) {
        super(IrTag.ARG, type, source);
        this.index = index;
    }

    public int index() {
        return index;
    }

    @Override
    public String toString() {
        return "arg" + index + ": " + type();
    }
}
