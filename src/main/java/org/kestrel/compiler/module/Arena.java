package org.kestrel.compiler.module;

import org.kestrel.compiler.ir.IrInst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns every typed instruction created while analyzing one declaration or function.
 * <p>
 * Inlined callee bodies allocate from the caller's arena, since their results outlive the callee's analysis.
 */
public final class Arena {

    private final String owner;
    private final List<IrInst> instructions = new ArrayList<>();

    public Arena(String owner) {
        this.owner = owner;
    }

    public <T extends IrInst> T add(T inst) {
        instructions.add(inst);
        return inst;
    }

    public String owner() {
        return owner;
    }

    public int size() {
        return instructions.size();
    }

    public List<IrInst> instructions() {
        return Collections.unmodifiableList(instructions);
    }
}
