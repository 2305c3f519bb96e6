package org.kestrel.compiler.module;

import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.ir.IrBody;
import org.kestrel.compiler.types.FnType;

/**
 * A function with a body to analyze, or an extern function without one.
 * <p>
 * Lifecycle: {@code QUEUED -> IN_PROGRESS -> SUCCESS | SEMA_FAILURE | DEPENDENCY_FAILURE}.
 */
public final class Function {

    public enum State {
        QUEUED,
        IN_PROGRESS,
        SUCCESS,
        SEMA_FAILURE,
        DEPENDENCY_FAILURE
    }

    private final String name;
    private final FnType fnType;
    private final UntypedCode code;
    private final boolean isExtern;
    private final Decl decl;
    private State state = State.QUEUED;
    private IrBody body;

    Function(String name, FnType fnType, UntypedCode code, boolean isExtern, Decl decl) {
        this.name = name;
        this.fnType = fnType;
        this.code = code;
        this.isExtern = isExtern;
        this.decl = decl;
    }

    public String name() {
        return name;
    }

    public FnType fnType() {
        return fnType;
    }

    /**
     * @return The body, or {@code null} for extern functions.
     */
    public UntypedCode code() {
        return code;
    }

    public boolean isExtern() {
        return isExtern;
    }

    /**
     * @return The declaration naming this function; its arena owns the analyzed body.
     */
    public Decl decl() {
        return decl;
    }

    public State state() {
        return state;
    }

    /**
     * @return The typed body; {@code null} until the state is {@link State#SUCCESS}.
     */
    public IrBody body() {
        return body;
    }

    void setState(State state) {
        this.state = state;
    }

    void succeed(IrBody body) {
        this.body = body;
        this.state = State.SUCCESS;
    }

    @Override
    public String toString() {
        return "Function{" + name + ": " + fnType + ", " + state + "}";
    }
}
