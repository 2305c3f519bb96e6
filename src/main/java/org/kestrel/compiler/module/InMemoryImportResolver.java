package org.kestrel.compiler.module;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves imports against a fixed set of registered files.
 */
public final class InMemoryImportResolver implements ImportResolver {

    private final Map<String, FileScope> files = new HashMap<>();

    public void register(FileScope file) {
        files.put(normalize(Path.of(file.path())), file);
    }

    @Override
    public FileScope resolveImport(FileScope current, String path) throws ImportException {
        Path dir = Path.of(current.path()).getParent();
        Path resolved = (dir == null ? Path.of(path) : dir.resolve(path)).normalize();
        boolean insideRoot = current.packageRoot().isEmpty()
                || resolved.startsWith(Path.of(current.packageRoot()).normalize());
        if (resolved.startsWith("..") || !insideRoot) {
            throw new ImportException(ImportException.Kind.OUTSIDE_PACKAGE, path);
        }
        FileScope file = files.get(normalize(resolved));
        if (file == null) {
            throw new ImportException(ImportException.Kind.NOT_FOUND, path);
        }
        return file;
    }

    private static String normalize(Path path) {
        return path.normalize().toString().replace('\\', '/');
    }
}
