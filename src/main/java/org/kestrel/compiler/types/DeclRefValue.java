package org.kestrel.compiler.types;

import org.kestrel.compiler.module.Decl;

/**
 * A compile-time-known pointer to a declaration's value.
 */
public record DeclRefValue(Decl decl) implements Value {

    @Override
    public String toString() {
        return "&" + decl.name();
    }
}
