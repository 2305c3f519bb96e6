package org.kestrel.compiler.frontend.untyped;

import org.kestrel.compiler.api.SourceInfo;

/**
 * One instruction of the untyped stream.
 *
 * @param tag    The opcode.
 * @param data   The operands; the variant depends on the opcode.
 * @param source The location the instruction was lowered from.
 */
public record UntypedInstruction(Tag tag, InstData data, SourceInfo source) {

    /**
     * @param type The expected data variant.
     * @return The operands, cast to the expected variant.
     * @throws IllegalStateException if the instruction carries a different variant.
     */
    public <T extends InstData> T data(Class<T> type) {
        if (!type.isInstance(data)) {
            throw new IllegalStateException(tag + " carries " + data.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(data);
    }
}
