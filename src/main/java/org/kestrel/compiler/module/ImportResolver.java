package org.kestrel.compiler.module;

/**
 * Loads the file an import names.
 */
@FunctionalInterface
public interface ImportResolver {

    /**
     * @param current The file containing the import.
     * @param path    The import path, relative to the directory of {@code current}.
     * @return The imported file.
     * @throws ImportException if the file does not exist or lies outside the package.
     */
    FileScope resolveImport(FileScope current, String path) throws ImportException;
}
