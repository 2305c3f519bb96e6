package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.Value;

/**
 * A typed instruction. Instructions are owned by the arena of the declaration or function being analyzed
 * and referenced from {@link IrBody} lists; identity matters, so subclasses do not override {@code equals}.
 */
public abstract class IrInst {

    private final IrTag tag;
    private final SourceInfo source;
    protected Type type;

    protected IrInst(IrTag tag, Type type, SourceInfo source) {
        this.tag = tag;
        this.type = type;
        this.source = source;
    }

    public IrTag tag() {
        return tag;
    }

    public Type type() {
        return type;
    }

    public SourceInfo source() {
        return source;
    }

    /**
     * @return The compile-time-known value, or {@code null} if the value is only known at runtime.
     */
    public Value value() {
        return null;
    }

    public boolean isComptimeKnown() {
        return value() != null;
    }

    public boolean isNoReturn() {
        return type.isNoReturn();
    }

    @Override
    public String toString() {
        return tag.name().toLowerCase() + ": " + type;
    }
}
