package org.kestrel.compiler.module;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.types.TypedValue;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named (or anonymous) declaration whose value is computed at compile time.
 * <p>
 * Lifecycle: {@code CREATED -> IN_PROGRESS -> COMPLETE | SEMA_FAILURE | DEPENDENCY_FAILURE}.
 * Compared by identity.
 */
public final class Decl {

    public enum Status {
        CREATED,
        IN_PROGRESS,
        COMPLETE,
        /** Analysis of this declaration reported an error. */
        SEMA_FAILURE,
        /** A declaration this one depends on failed. */
        DEPENDENCY_FAILURE;

        public boolean isFailure() {
            return this == SEMA_FAILURE || this == DEPENDENCY_FAILURE;
        }
    }

    private final String name;
    private final FileScope scope;
    private final UntypedCode code;
    private final SourceInfo source;
    private final Arena arena;
    private final Set<Decl> dependencies = new LinkedHashSet<>();
    private final Set<Decl> dependants = new LinkedHashSet<>();
    private Status status = Status.CREATED;
    private TypedValue typedValue;
    private Function function;

    Decl(String name, FileScope scope, UntypedCode code, SourceInfo source) {
        this.name = name;
        this.scope = scope;
        this.code = code;
        this.source = source;
        this.arena = new Arena(name);
    }

    public String name() {
        return name;
    }

    public FileScope scope() {
        return scope;
    }

    /**
     * @return The code computing the value, or {@code null} if the value was supplied directly.
     */
    public UntypedCode code() {
        return code;
    }

    public SourceInfo source() {
        return source;
    }

    public Arena arena() {
        return arena;
    }

    public Status status() {
        return status;
    }

    /**
     * @return The analyzed type and value; {@code null} until the status is {@link Status#COMPLETE}.
     */
    public TypedValue typedValue() {
        return typedValue;
    }

    /**
     * @return The function this declaration names, or {@code null}.
     */
    public Function function() {
        return function;
    }

    public Set<Decl> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Set<Decl> dependants() {
        return Collections.unmodifiableSet(dependants);
    }

    void setStatus(Status status) {
        this.status = status;
    }

    void complete(TypedValue value) {
        this.typedValue = value;
        this.status = Status.COMPLETE;
    }

    void setFunction(Function function) {
        this.function = function;
    }

    void addDependency(Decl other) {
        dependencies.add(other);
        other.dependants.add(this);
    }

    @Override
    public String toString() {
        return "Decl{" + name + ", " + status + "}";
    }
}
