package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.config.BuildMode;
import org.kestrel.compiler.config.SemaConfig;
import org.kestrel.compiler.diagnostics.Diagnostic;
import org.kestrel.compiler.frontend.semantics.SemaTestSupport;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Types;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kestrel.compiler.frontend.untyped.Tag.*;

/**
 * Contains unit tests for compile logs, user compile errors, result checks and unreachable code.
 */
@Tag("unit")
public class DebugAnalysisHandlerTest {

    /**
     * Verifies that a compile log records the typed operands and fails the analysis at the log's location.
     */
    @Test
    void testCompileLogFormatsOperandsAndFailsAnalysis() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> {
            int three = b.bin(AS, Ref.U8_TYPE, b.intLit(3));
            b.multiOp(COMPILE_LOG, b.intLit(5), three);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(x.status()).isEqualTo(Decl.Status.COMPLETE);
        assertThat(support.engine().getCompileLogText()).isEqualTo("@as(comptime_int, 5), @as(u8, 3)\n");
        assertThat(support.errors()).containsExactly("found compile log statement");
        assertThat(support.diagnostics().get(0).source()).isEqualTo(support.engine().getCompileLogSources().get(0));
    }

    @Test
    void testCompileLogOfRuntimeValue() {
        SemaTestSupport support = new SemaTestSupport();
        support.function("f", List.of(Types.U8), SimpleType.VOID, b -> {
            b.multiOp(COMPILE_LOG, b.param(0));
            b.ret(Ref.NONE);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.engine().getCompileLogText()).isEqualTo("@as(u8, [runtime value])\n");
    }

    @Test
    void testCompileErrorReportsUserMessage() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.un(COMPILE_ERROR, b.str("boom")));

        assertThat(support.analyze()).isFalse();
        Diagnostic diagnostic = support.diagnostics().get(0);
        assertThat(diagnostic.message()).isEqualTo("boom");
        assertThat(diagnostic.code()).isEqualTo(CompilerErrorCode.USER_COMPILE_ERROR);
    }

    @Test
    void testIgnoredValueIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.function("f", List.of(Types.U8), SimpleType.VOID, b -> {
            b.un(ENSURE_RESULT_USED, b.param(0));
            b.ret(Ref.NONE);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("expression value is ignored");
    }

    @Test
    void testVoidResultMayBeIgnored() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.un(ENSURE_RESULT_USED, b.voidValue()));

        assertThat(support.analyze()).isTrue();
    }

    @Test
    void testDiscardedErrorIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.un(ENSURE_RESULT_NON_ERROR, b.named(ERROR_VALUE, "Oops")));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("error is discarded");
    }

    @Test
    void testSafeUnreachableTrapsInDebugBuild() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(), SimpleType.VOID, b -> b.node(UNREACHABLE_SAFE));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.BREAKPOINT, IrTag.UNREACH);
    }

    @Test
    void testSafeUnreachableInReleaseFastBuild() {
        SemaTestSupport support = new SemaTestSupport(SemaConfig.DEFAULTS.withBuildMode(BuildMode.RELEASE_FAST));
        Decl f = support.function("f", List.of(), SimpleType.VOID, b -> b.node(UNREACHABLE_SAFE));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.UNREACH);
    }

    @Test
    void testBreakpointIsRejectedAtCompileTime() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.node(BREAKPOINT));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("unable to resolve comptime value");
        assertThat(support.diagnostics().get(0).code()).isEqualTo(CompilerErrorCode.NOT_COMPTIME_KNOWN);
    }
}
