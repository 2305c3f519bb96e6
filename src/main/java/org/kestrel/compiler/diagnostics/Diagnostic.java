package org.kestrel.compiler.diagnostics;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during semantic analysis.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param source The location of the issue.
 * @param code The classification of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        SourceInfo source,
        CompilerErrorCode code
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents code generation for the declaration. */
        ERROR,
        /** A warning that does not prevent code generation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, source.fileName(), source.lineNumber(), message);
    }
}
