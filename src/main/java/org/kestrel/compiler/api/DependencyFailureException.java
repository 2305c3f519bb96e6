package org.kestrel.compiler.api;

/**
 * Signals that a referenced declaration failed its own analysis.
 * No diagnostic is recorded for this failure; the dependency already reported its own.
 */
public class DependencyFailureException extends SemanticException {

    /**
     * @param dependencyName The name of the failed declaration.
     * @param sourceInfo The location of the reference.
     */
    public DependencyFailureException(String dependencyName, SourceInfo sourceInfo) {
        super("dependency '" + dependencyName + "' failed analysis", sourceInfo, CompilerErrorCode.DEPENDENCY_FAILURE);
    }
}
