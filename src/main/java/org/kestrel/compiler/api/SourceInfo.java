package org.kestrel.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is attached to every untyped and typed instruction and to every diagnostic.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number (1-based, 0 if unknown).
 * @param columnNumber The column number (1-based, 0 if unknown).
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Location used for synthesized instructions that have no source counterpart. */
    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", 0, 0);

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
