package org.kestrel.compiler.ir;

import java.util.List;

/**
 * An ordered instruction list, the body of a block, a branch or a function.
 */
public record IrBody(List<IrInst> instructions) {

    public static final IrBody EMPTY = new IrBody(List.of());

    public IrBody {
        instructions = List.copyOf(instructions);
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public IrInst last() {
        return instructions.get(instructions.size() - 1);
    }
}
