package org.kestrel.compiler.module;

/**
 * Assigns stable integer codes to error names.
 */
@FunctionalInterface
public interface ErrorInterner {

    /**
     * @param name An error name.
     * @return The code of the name; the same name always yields the same code.
     */
    int internError(String name);
}
