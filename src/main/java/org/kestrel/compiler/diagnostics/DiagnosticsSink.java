package org.kestrel.compiler.diagnostics;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;

/**
 * Receives the user-facing output of semantic analysis.
 * <p>
 * {@link #fail} records an error and returns the exception that the caller throws, so that
 * every failure site reads {@code throw sink.fail(...)}.
 */
public interface DiagnosticsSink {

    /**
     * Records an error and returns the exception that aborts the current declaration.
     *
     * @param source The location of the error.
     * @param code   The classification of the error.
     * @param format A {@link String#format} pattern.
     * @param args   The pattern arguments.
     * @return The exception to throw.
     */
    SemanticException fail(SourceInfo source, CompilerErrorCode code, String format, Object... args);

    /**
     * Records an unclassified error and returns the exception that aborts the current declaration.
     *
     * @param source The location of the error.
     * @param format A {@link String#format} pattern.
     * @param args   The pattern arguments.
     * @return The exception to throw.
     */
    default SemanticException fail(SourceInfo source, String format, Object... args) {
        return fail(source, CompilerErrorCode.UNCLASSIFIED, format, args);
    }

    /**
     * Collects one line of compile-log text. This is a side channel, not a failure.
     *
     * @param source The location of the compile-log statement.
     * @param text   The formatted line.
     */
    void compileLog(SourceInfo source, String text);
}
