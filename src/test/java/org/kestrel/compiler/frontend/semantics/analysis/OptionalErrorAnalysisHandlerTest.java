package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.config.BuildMode;
import org.kestrel.compiler.config.SemaConfig;
import org.kestrel.compiler.frontend.semantics.SemaTestSupport;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.frontend.untyped.UntypedCodeBuilder;
import org.kestrel.compiler.ir.IrBlock;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.types.ErrorSetType;
import org.kestrel.compiler.types.ErrorUnionType;
import org.kestrel.compiler.types.ErrorValue;
import org.kestrel.compiler.types.OptionalType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Values;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kestrel.compiler.frontend.untyped.Tag.*;

@Tag("unit")
public class OptionalErrorAnalysisHandlerTest {

    private static final OptionalType OPTIONAL_U8 = new OptionalType(Types.U8);
    private static final ErrorUnionType OOPS_OR_U8 = new ErrorUnionType(new ErrorSetType(List.of("Oops")), Types.U8);

    private static int oopsOrU8(UntypedCodeBuilder b) {
        return b.bin(ERROR_UNION_TYPE, b.errorSet("Oops"), Ref.U8_TYPE);
    }

    /**
     * Verifies that a safe unwrap of a runtime optional is preceded by a null check that traps.
     */
    @Test
    void testRuntimeSafeUnwrapInsertsNullCheck() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(OPTIONAL_U8), Types.U8,
                b -> b.ret(b.un(OPTIONAL_PAYLOAD_SAFE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag)
                .containsExactly(IrTag.IS_NON_NULL, IrTag.BLOCK, IrTag.OPTIONAL_PAYLOAD, IrTag.RET);
        IrBlock check = (IrBlock) body.get(1);
        assertThat(check.type()).isEqualTo(SimpleType.VOID);
        assertThat(check.body().instructions()).extracting(IrInst::tag).containsExactly(IrTag.CONDBR);
        assertThat(body.get(2).type()).isEqualTo(Types.U8);
    }

    @Test
    void testReleaseFastOmitsNullCheck() {
        SemaTestSupport support = new SemaTestSupport(SemaConfig.DEFAULTS.withBuildMode(BuildMode.RELEASE_FAST));
        Decl f = support.function("f", List.of(OPTIONAL_U8), Types.U8,
                b -> b.ret(b.un(OPTIONAL_PAYLOAD_SAFE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.OPTIONAL_PAYLOAD, IrTag.RET);
    }

    @Test
    void testUnsafeUnwrapHasNoCheck() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(OPTIONAL_U8), Types.U8,
                b -> b.ret(b.un(OPTIONAL_PAYLOAD_UNSAFE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.OPTIONAL_PAYLOAD, IrTag.RET);
    }

    @Test
    void testComptimeUnwrapOfNullIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> {
            int optional = b.bin(AS, b.un(OPTIONAL_TYPE, Ref.U8_TYPE), Ref.NULL_VALUE);
            b.un(OPTIONAL_PAYLOAD_SAFE, optional);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("unable to unwrap null");
        assertThat(support.diagnostics().get(0).code()).isEqualTo(CompilerErrorCode.UNWRAP_NULL);
        assertThat(x.status()).isEqualTo(Decl.Status.SEMA_FAILURE);
    }

    @Test
    void testComptimeUnwrapOfValueFolds() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> {
            int optional = b.bin(AS, b.un(OPTIONAL_TYPE, Ref.U8_TYPE), b.intLit(7));
            b.un(OPTIONAL_PAYLOAD_SAFE, optional);
        });

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(Types.U8);
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(7);
    }

    @Test
    void testComptimeIsNullFolds() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> {
            int optional = b.bin(AS, b.un(OPTIONAL_TYPE, Ref.U8_TYPE), Ref.NULL_VALUE);
            b.un(IS_NULL, optional);
        });

        assertThat(support.analyze()).isTrue();
        assertThat(Values.toBool(x.typedValue().value())).isTrue();
    }

    @Test
    void testComptimeUnwrapOfErrorIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> {
            int value = b.bin(AS, oopsOrU8(b), b.named(ERROR_VALUE, "Oops"));
            b.un(ERR_UNION_PAYLOAD_SAFE, value);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("caught unexpected error 'Oops'");
        assertThat(support.diagnostics().get(0).code()).isEqualTo(CompilerErrorCode.UNWRAP_ERROR);
    }

    @Test
    void testComptimeErrorCodeOfError() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> {
            int value = b.bin(AS, oopsOrU8(b), b.named(ERROR_VALUE, "Oops"));
            b.un(ERR_UNION_CODE, value);
        });

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(new ErrorSetType(List.of("Oops")));
        assertThat(x.typedValue().value()).isEqualTo(new ErrorValue("Oops"));
    }

    @Test
    void testComptimeErrorCodeOfPayloadIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> {
            int value = b.bin(AS, oopsOrU8(b), b.intLit(5));
            b.un(ERR_UNION_CODE, value);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("error union value '5' holds no error");
    }

    @Test
    void testRuntimeSafeErrorUnwrapInsertsCheck() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(OOPS_OR_U8), Types.U8,
                b -> b.ret(b.un(ERR_UNION_PAYLOAD_SAFE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag)
                .containsExactly(IrTag.IS_NON_ERR, IrTag.BLOCK, IrTag.UNWRAP_ERRUNION_PAYLOAD, IrTag.RET);
    }

    @Test
    void testIsErrOnRuntimeErrorUnion() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(OOPS_OR_U8), SimpleType.BOOL,
                b -> b.ret(b.un(IS_ERR, b.param(0))));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.IS_ERR, IrTag.RET);
    }

    @Test
    void testNonVoidPayloadCannotBeIgnored() {
        SemaTestSupport support = new SemaTestSupport();
        support.function("f", List.of(OOPS_OR_U8), SimpleType.VOID, b -> {
            b.un(ENSURE_ERR_PAYLOAD_VOID, b.param(0));
            b.ret(Ref.NONE);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("expression value is ignored");
    }
}
