package org.kestrel.compiler.module;

import org.kestrel.compiler.types.Namespace;
import org.kestrel.compiler.types.StructType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One source file. Its declarations are the members of its root container type.
 */
public final class FileScope implements Namespace {

    private final String path;
    private final String packageRoot;
    private final StructType rootType;
    private final Map<String, Decl> decls = new LinkedHashMap<>();

    /**
     * @param path        The file path, normalized, with {@code /} separators.
     * @param packageRoot The directory imports must stay inside; empty for the current directory.
     */
    public FileScope(String path, String packageRoot) {
        this.path = path;
        this.packageRoot = packageRoot;
        this.rootType = new StructType("(struct " + path + ")", this);
    }

    public String path() {
        return path;
    }

    public String packageRoot() {
        return packageRoot;
    }

    public StructType rootType() {
        return rootType;
    }

    @Override
    public Optional<Decl> lookupDecl(String name) {
        return Optional.ofNullable(decls.get(name));
    }

    public Collection<Decl> decls() {
        return Collections.unmodifiableCollection(decls.values());
    }

    void addDecl(Decl decl) {
        if (decls.putIfAbsent(decl.name(), decl) != null) {
            throw new IllegalArgumentException("redeclaration of '" + decl.name() + "' in " + path);
        }
    }

    @Override
    public String toString() {
        return path;
    }
}
