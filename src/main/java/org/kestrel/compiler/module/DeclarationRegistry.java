package org.kestrel.compiler.module;

import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.types.TypedValue;

/**
 * Access to declarations from within the analysis of another declaration.
 */
public interface DeclarationRegistry {

    /**
     * Analyzes the declaration if that has not happened yet.
     *
     * @param decl The declaration.
     * @return Its type and value.
     * @throws SemanticException if the declaration or one of its dependencies failed.
     */
    TypedValue ensureAnalyzed(Decl decl) throws SemanticException;

    /**
     * Records that {@code from} uses {@code to}, so that a failure of {@code to} fails {@code from}.
     */
    void declareDependency(Decl from, Decl to);

    /**
     * @return The analyzed type and value; {@code null} while the declaration is not complete.
     */
    TypedValue typedValueOf(Decl decl);

    /**
     * Creates a complete, unnamed declaration holding a value, such as a string literal.
     *
     * @param owner The declaration whose analysis creates it.
     * @param value The value.
     * @return The new declaration.
     */
    Decl createAnonymousDecl(Decl owner, TypedValue value);
}
