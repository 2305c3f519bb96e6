package org.kestrel.compiler.module;

/**
 * Thrown by an {@link ImportResolver} when an import path cannot be resolved.
 */
public class ImportException extends Exception {

    public enum Kind {
        NOT_FOUND,
        OUTSIDE_PACKAGE
    }

    private final Kind kind;
    private final String importPath;

    public ImportException(Kind kind, String importPath) {
        super(kind + ": " + importPath);
        this.kind = kind;
        this.importPath = importPath;
    }

    public Kind getKind() {
        return kind;
    }

    public String getImportPath() {
        return importPath;
    }
}
