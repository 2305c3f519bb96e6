package org.kestrel.compiler.types;

import org.kestrel.compiler.module.Decl;

import java.util.Optional;

/**
 * The declarations visible as members of a container type.
 */
public interface Namespace {

    /**
     * @param name The member name.
     * @return The declaration, if the container has one with this name.
     */
    Optional<Decl> lookupDecl(String name);
}
