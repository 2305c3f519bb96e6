package org.kestrel.compiler.types;

import org.kestrel.compiler.module.Function;

/**
 * A function body (or an extern function) used as a value.
 */
public record FunctionValue(Function function) implements Value {

    @Override
    public String toString() {
        return "(function '" + function.name() + "')";
    }
}
