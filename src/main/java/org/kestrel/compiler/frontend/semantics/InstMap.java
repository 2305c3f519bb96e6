package org.kestrel.compiler.frontend.semantics;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.kestrel.compiler.ir.IrInst;

/**
 * Maps untyped instruction indices to their typed results within one analysis activation.
 * An inlined call starts a fresh map, since the callee's indices belong to a different stream.
 */
public final class InstMap {

    private final Int2ObjectOpenHashMap<IrInst> results = new Int2ObjectOpenHashMap<>();

    /**
     * @throws IllegalStateException if the index already has a result.
     */
    public void put(int index, IrInst result) {
        IrInst previous = results.putIfAbsent(index, result);
        if (previous != null && previous != result) {
            throw new IllegalStateException("instruction %" + index + " analyzed twice");
        }
    }

    /**
     * @return The typed result, or {@code null} if the index was not analyzed.
     */
    public IrInst get(int index) {
        return results.get(index);
    }

    public boolean contains(int index) {
        return results.containsKey(index);
    }

    public int size() {
        return results.size();
    }
}
