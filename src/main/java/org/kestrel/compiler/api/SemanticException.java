package org.kestrel.compiler.api;

/**
 * Thrown when analysis of a declaration or function fails with a user compile error.
 * <p>
 * It is part of the public API. The exception aborts analysis of the current declaration only;
 * the diagnostic describing the failure has already been recorded by the time it is thrown.
 */
public class SemanticException extends Exception {

    private final transient SourceInfo sourceInfo;
    private final CompilerErrorCode errorCode;

    /**
     * Constructs a new semantic exception with the specified detail message.
     * @param message The detail message.
     * @param sourceInfo The location the error refers to.
     * @param errorCode The classification of the error.
     */
    public SemanticException(String message, SourceInfo sourceInfo, CompilerErrorCode errorCode) {
        super(message, null);
        this.sourceInfo = sourceInfo;
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new semantic exception with the specified detail message and cause.
     * @param message The detail message.
     * @param sourceInfo The location the error refers to.
     * @param cause The cause.
     */
    public SemanticException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, cause);
        this.sourceInfo = sourceInfo;
        this.errorCode = CompilerErrorCode.UNCLASSIFIED;
    }

    /**
     * @return The location the error refers to.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * @return The classification of the error.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }
}
