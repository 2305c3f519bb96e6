package org.kestrel.compiler.module;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.DependencyFailureException;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.config.ConfigLoader;
import org.kestrel.compiler.config.LoggingConfigurator;
import org.kestrel.compiler.config.SemaConfig;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.diagnostics.DiagnosticsEngine;
import org.kestrel.compiler.frontend.semantics.HandlerRegistry;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.types.CallingConvention;
import org.kestrel.compiler.types.FnType;
import org.kestrel.compiler.types.FunctionValue;
import org.kestrel.compiler.types.TypedValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The unit of compilation: owns the declarations of a set of files, tracks their lifecycle and
 * drives semantic analysis over them. It is not thread-safe.
 * <p>
 * A failure aborts the declaration or function it occurs in; other units continue. Dependants of a
 * failed declaration are marked {@link Decl.Status#DEPENDENCY_FAILURE} without being analyzed.
 * <p>
 * Analysis runs on a dedicated thread with a stack of {@link SemaConfig#stackSize()} bytes, since
 * compile-time calls are evaluated by recursive inlining. Evaluation that nests deeper than that
 * stack fails the declaration it started in.
 */
public class Module implements DeclarationRegistry, ErrorInterner {

    private final DiagnosticsEngine diagnostics;
    private final SemaConfig config;
    private final Sema sema;
    private final Set<FileScope> files = new LinkedHashSet<>();
    private final List<Function> functions = new ArrayList<>();
    private final Object2IntOpenHashMap<String> errorCodes = new Object2IntOpenHashMap<>();
    private final List<String> errorNames = new ArrayList<>();
    private int anonymousCount;
    private Thread analysisThread;

    /**
     * @param diagnostics Collects the errors and compile-log output of every unit.
     * @param imports     Loads the files named by {@code import}.
     * @param config      The analysis settings.
     */
    public Module(DiagnosticsEngine diagnostics, ImportResolver imports, SemaConfig config) {
        this.diagnostics = diagnostics;
        this.config = config;
        this.errorCodes.defaultReturnValue(0);
        SemaContext context = new SemaContext(diagnostics, this, imports, this, config);
        this.sema = new Sema(context, HandlerRegistry.initializeWithDefaults());
    }

    /**
     * Creates a module from the resolved application configuration and applies its logging settings.
     *
     * @throws ConfigException if the analysis settings are missing or invalid.
     */
    public static Module fromConfig(DiagnosticsEngine diagnostics, ImportResolver imports, Config config) {
        LoggingConfigurator.configure(config);
        return new Module(diagnostics, imports, SemaConfig.fromConfig(config));
    }

    /**
     * Creates a module configured by {@link ConfigLoader#load()}.
     */
    public static Module load(DiagnosticsEngine diagnostics, ImportResolver imports) {
        return fromConfig(diagnostics, imports, ConfigLoader.load());
    }

    // region declarations

    /**
     * Declares a value computed at compile time by {@code code}.
     *
     * @throws IllegalArgumentException if the name is already declared in the file.
     */
    public Decl declareValue(FileScope scope, String name, UntypedCode code) {
        Decl decl = new Decl(name, scope, code, new SourceInfo(code.fileName(), 0, 0));
        addToScope(scope, decl);
        return decl;
    }

    /**
     * Declares a function with a body. The declaration is complete at once; its value is the function.
     *
     * @throws IllegalArgumentException if the body's parameter count does not match the type.
     */
    public Decl declareFunction(FileScope scope, String name, FnType fnType, UntypedCode code) {
        if (code.paramCount() != fnType.paramTypes().size()) {
            throw new IllegalArgumentException("function '" + name + "' has " + fnType.paramTypes().size()
                    + " parameter type(s) but its body declares " + code.paramCount());
        }
        return declareFunction(scope, name, fnType, code, false, new SourceInfo(code.fileName(), 0, 0));
    }

    /**
     * Declares a function without a body; it can be called at runtime only.
     */
    public Decl declareExternFunction(FileScope scope, String name, FnType fnType) {
        return declareFunction(scope, name, fnType, null, true, new SourceInfo(scope.path(), 0, 0));
    }

    private Decl declareFunction(FileScope scope, String name, FnType fnType, UntypedCode code, boolean isExtern,
                                 SourceInfo source) {
        Decl decl = new Decl(name, scope, null, source);
        Function function = new Function(name, fnType, code, isExtern, decl);
        decl.setFunction(function);
        decl.complete(new TypedValue(fnType, new FunctionValue(function)));
        addToScope(scope, decl);
        functions.add(function);
        return decl;
    }

    private void addToScope(FileScope scope, Decl decl) {
        scope.addDecl(decl);
        files.add(scope);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Decl createAnonymousDecl(Decl owner, TypedValue value) {
        Decl decl = new Decl("__anon_" + anonymousCount++, owner.scope(), null, owner.source());
        decl.complete(value);
        return decl;
    }

    /**
     * @return The functions in declaration order.
     */
    public List<Function> functions() {
        return Collections.unmodifiableList(functions);
    }

    // endregion

    // region lifecycle

    /**
     * {@inheritDoc}
     */
    @Override
    public TypedValue ensureAnalyzed(Decl decl) throws SemanticException {
        if (decl.status() == Decl.Status.CREATED && Thread.currentThread() != analysisThread) {
            return onAnalysisThread(() -> ensureAnalyzedOutermost(decl));
        }
        switch (decl.status()) {
            case COMPLETE:
                return decl.typedValue();
            case SEMA_FAILURE:
            case DEPENDENCY_FAILURE:
                throw new DependencyFailureException(decl.name(), decl.source());
            case IN_PROGRESS:
                throw diagnostics.fail(decl.source(), CompilerErrorCode.DEPENDENCY_LOOP, "dependency loop detected");
            case CREATED:
            default:
                try {
                    return analyzeDecl(decl);
                } catch (SemanticException e) {
                    throw new DependencyFailureException(decl.name(), decl.source());
                }
        }
    }

    private TypedValue ensureAnalyzedOutermost(Decl decl) throws SemanticException {
        try {
            return ensureAnalyzed(decl);
        } catch (StackOverflowError e) {
            failTooDeep(decl);
            throw new DependencyFailureException(decl.name(), decl.source());
        }
    }

    private TypedValue analyzeDecl(Decl decl) throws SemanticException {
        CompilerLogger.debug("analyzing declaration '{}'", decl.name());
        decl.setStatus(Decl.Status.IN_PROGRESS);
        try {
            TypedValue value = sema.analyzeDeclValue(decl);
            decl.complete(value);
            return value;
        } catch (DependencyFailureException e) {
            markFailed(decl, Decl.Status.DEPENDENCY_FAILURE);
            throw e;
        } catch (SemanticException e) {
            markFailed(decl, Decl.Status.SEMA_FAILURE);
            throw e;
        } catch (StackOverflowError e) {
            // reported once the stack has unwound to the outermost unit
            decl.setStatus(Decl.Status.SEMA_FAILURE);
            throw e;
        }
    }

    private void failTooDeep(Decl decl) {
        diagnostics.fail(decl.source(), CompilerErrorCode.EVALUATION_TOO_DEEP,
                "evaluation of '%s' nested too deeply for the analysis stack of %d bytes",
                decl.name(), config.stackSize());
        markFailed(decl, Decl.Status.SEMA_FAILURE);
    }

    private void markFailed(Decl decl, Decl.Status status) {
        decl.setStatus(status);
        for (Decl dependant : decl.dependants()) {
            Function function = dependant.function();
            if (function != null) {
                if (function.state() == Function.State.QUEUED || function.state() == Function.State.IN_PROGRESS) {
                    function.setState(Function.State.DEPENDENCY_FAILURE);
                }
            } else if (!dependant.status().isFailure()) {
                markFailed(dependant, Decl.Status.DEPENDENCY_FAILURE);
            }
        }
    }

    /**
     * Analyzes the body of a function unless that has already happened.
     *
     * @return {@code true} if the body was analyzed successfully.
     */
    public boolean analyzeFunction(Function function) {
        if (Thread.currentThread() != analysisThread) {
            return onAnalysisThread(() -> analyzeFunction(function));
        }
        if (function.state() != Function.State.QUEUED) {
            return function.state() == Function.State.SUCCESS;
        }
        CompilerLogger.debug("analyzing function '{}'", function.name());
        function.setState(Function.State.IN_PROGRESS);
        try {
            function.succeed(sema.analyzeFnBody(function));
            return true;
        } catch (DependencyFailureException e) {
            function.setState(Function.State.DEPENDENCY_FAILURE);
            CompilerLogger.debug("{}: {}", function.name(), e.getMessage());
        } catch (SemanticException e) {
            function.setState(Function.State.SEMA_FAILURE);
            CompilerLogger.debug("{} failed at {}: {}", function.name(), e.getSourceInfo(), e.getMessage());
        } catch (StackOverflowError e) {
            function.setState(Function.State.SEMA_FAILURE);
            diagnostics.fail(function.decl().source(), CompilerErrorCode.EVALUATION_TOO_DEEP,
                    "evaluation of '%s' nested too deeply for the analysis stack of %d bytes",
                    function.name(), config.stackSize());
        }
        return false;
    }

    /**
     * Analyzes every declaration, then every function body that is not extern or inline-only.
     *
     * @return {@code true} if no error was reported.
     */
    public boolean analyzeAll() {
        if (Thread.currentThread() != analysisThread) {
            return onAnalysisThread(this::analyzeAll);
        }
        for (FileScope file : files) {
            for (Decl decl : List.copyOf(file.decls())) {
                if (decl.status() != Decl.Status.CREATED) {
                    continue;
                }
                try {
                    analyzeDecl(decl);
                } catch (SemanticException e) {
                    CompilerLogger.debug("{} failed at {}: {}", decl.name(), e.getSourceInfo(), e.getMessage());
                } catch (StackOverflowError e) {
                    failTooDeep(decl);
                }
            }
        }
        for (Function function : List.copyOf(functions)) {
            if (function.isExtern() || function.fnType().cc() == CallingConvention.INLINE) {
                continue;
            }
            analyzeFunction(function);
        }
        List<SourceInfo> compileLogs = diagnostics.getCompileLogSources();
        if (!compileLogs.isEmpty()) {
            diagnostics.reportError("found compile log statement", compileLogs.get(0));
        }
        if (diagnostics.hasErrors()) {
            CompilerLogger.info("semantic analysis failed:\n{}", diagnostics.summary());
            return false;
        }
        return true;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void declareDependency(Decl from, Decl to) {
        from.addDependency(to);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public TypedValue typedValueOf(Decl decl) {
        return decl.status() == Decl.Status.COMPLETE ? decl.typedValue() : null;
    }

    // region analysis thread

    @FunctionalInterface
    private interface AnalysisTask<T, E extends Exception> {
        T run() throws E;
    }

    /**
     * Runs {@code task} on a new analysis thread and waits for it. Failures are rethrown on the caller.
     */
    private <T, E extends Exception> T onAnalysisThread(AnalysisTask<T, E> task) throws E {
        Object[] result = new Object[1];
        Throwable[] failure = new Throwable[1];
        Thread thread = new Thread(null, () -> {
            try {
                result[0] = task.run();
            } catch (Exception | Error e) {
                failure[0] = e;
            }
        }, "kestrel-sema", config.stackSize());
        analysisThread = thread;
        try {
            thread.start();
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for semantic analysis", e);
        } finally {
            analysisThread = null;
        }
        return rethrow(result, failure[0]);
    }

    @SuppressWarnings("unchecked")
    private static <T, E extends Exception> T rethrow(Object[] result, Throwable failure) throws E {
        if (failure == null) {
            return (T) result[0];
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw (E) failure;
    }

    // endregion

    // region error interning

    /**
     * {@inheritDoc}
     */
    @Override
    public int internError(String name) {
        int code = errorCodes.getInt(name);
        if (code == 0) {
            errorNames.add(name);
            code = errorNames.size();
            errorCodes.put(name, code);
        }
        return code;
    }

    /**
     * @param code A code returned by {@link #internError}.
     * @return The error name.
     */
    public String errorName(int code) {
        return errorNames.get(code - 1);
    }

    // endregion

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public SemaConfig config() {
        return config;
    }

    public Sema sema() {
        return sema;
    }
}
