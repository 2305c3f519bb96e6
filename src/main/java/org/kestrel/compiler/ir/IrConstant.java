package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.Value;

/**
 * A compile-time-known typed value.
 */
public final class IrConstant extends IrInst {

    private final Value value;

    public IrConstant(Type type, Value value, SourceInfo source) {
        super(IrTag.CONSTANT, type, source);
        this.value = value;
    }

    @Override
    public Value value() {
        return value;
    }

    @Override
    public String toString() {
        return "constant(" + type() + ", " + value + ")";
    }
}
