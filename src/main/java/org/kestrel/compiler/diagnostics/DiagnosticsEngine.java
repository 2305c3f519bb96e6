package org.kestrel.compiler.diagnostics;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during semantic analysis.
 * <p>
 * This decouples error reporting from the analysis logic itself.
 */
public class DiagnosticsEngine implements DiagnosticsSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<SourceInfo> compileLogSources = new ArrayList<>();
    private final StringBuilder compileLogText = new StringBuilder();

    @Override
    public SemanticException fail(SourceInfo source, CompilerErrorCode code, String format, Object... args) {
        String message = args.length == 0 ? format : String.format(format, args);
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, source, code));
        CompilerLogger.debug("error at {}: {}", source, message);
        return new SemanticException(message, source, code);
    }

    @Override
    public void compileLog(SourceInfo source, String text) {
        compileLogSources.add(source);
        compileLogText.append(text).append('\n');
        CompilerLogger.info("compile log: {}", text);
    }

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param source  The location of the error.
     */
    public void reportError(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, source, CompilerErrorCode.UNCLASSIFIED));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  The location of the warning.
     */
    public void reportWarning(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, source, CompilerErrorCode.UNCLASSIFIED));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The collected compile-log text, one line per statement.
     */
    public String getCompileLogText() {
        return compileLogText.toString();
    }

    /**
     * @return The locations of all compile-log statements, in the order they were analyzed.
     */
    public List<SourceInfo> getCompileLogSources() {
        return Collections.unmodifiableList(compileLogSources);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
