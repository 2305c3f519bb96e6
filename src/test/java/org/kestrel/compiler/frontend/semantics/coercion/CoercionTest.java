package org.kestrel.compiler.frontend.semantics.coercion;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.frontend.semantics.SemaTestSupport;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.types.CallingConvention;
import org.kestrel.compiler.types.FnType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Values;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kestrel.compiler.frontend.untyped.Tag.*;

/**
 * Contains unit tests for implicit conversions, driven through {@code as} instructions and call arguments.
 */
@Tag("unit")
public class CoercionTest {

    private SemaTestSupport support;

    @BeforeEach
    void setUp() {
        support = new SemaTestSupport();
    }

    /**
     * Verifies that an integer literal that fits the destination becomes a constant of that type.
     */
    @Test
    void testLiteralThatFitsIsConverted() {
        Decl x = support.declare("x", b -> b.bin(AS, Ref.U8_TYPE, b.intLit(200)));

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(Types.U8);
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(200L);
    }

    /**
     * Verifies that an integer literal outside the destination range is rejected.
     */
    @Test
    void testLiteralThatDoesNotFitIsReported() {
        Decl x = support.declare("x", b -> b.bin(AS, Ref.U8_TYPE, b.intLit(300)));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("type u8 cannot represent integer value 300");
        assertThat(support.diagnostics().get(0).code()).isEqualTo(CompilerErrorCode.VALUE_DOES_NOT_FIT);
        assertThat(x.status()).isEqualTo(Decl.Status.SEMA_FAILURE);
    }

    @Test
    void testNegativeLiteralIntoUnsignedIsReported() {
        support.declare("x", b -> b.bin(AS, Ref.U32_TYPE, b.intLit(-1)));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("type u32 cannot represent integer value -1");
    }

    @Test
    void testFloatLiteralWithFractionIntoIntegerIsReported() {
        support.declare("x", b -> b.bin(AS, Ref.I32_TYPE, b.floatLit(2.5)));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).singleElement().asString()
                .startsWith("fractional component prevents float value 2.5");
    }

    @Test
    void testNonFiniteFloatLiteralIntoIntegerIsReported() {
        support.declare("nan", b -> b.bin(AS, Ref.I32_TYPE, b.floatLit(Double.NaN)));
        support.declare("inf", b -> b.bin(AS, Ref.U8_TYPE, b.floatLit(Double.POSITIVE_INFINITY)));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly(
                "float value 'NaN' cannot be stored in integer type 'i32'",
                "float value 'Infinity' cannot be stored in integer type 'u8'");
        assertThat(support.diagnostics()).allSatisfy(
                d -> assertThat(d.code()).isEqualTo(CompilerErrorCode.VALUE_DOES_NOT_FIT));
    }

    @Test
    void testIntegralFloatLiteralIntoIntegerIsConverted() {
        Decl x = support.declare("x", b -> b.bin(AS, Ref.I32_TYPE, b.floatLit(4.0)));

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(Types.I32);
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(4L);
    }

    @Test
    void testNullIntoOptionalIsConverted() {
        Decl x = support.declare("x", b -> {
            int optional = b.un(OPTIONAL_TYPE, Ref.U8_TYPE);
            b.bin(AS, optional, Ref.NULL_VALUE);
        });

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type().toString()).isEqualTo("?u8");
        assertThat(x.typedValue().value().isNull()).isTrue();
    }

    /**
     * Verifies that a runtime integer is widened with an {@code intcast}.
     */
    @Test
    void testRuntimeIntegerIsWidened() {
        Decl f = support.function("widen", List.of(Types.U8), Types.U16, b -> b.ret(b.param(0)));

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.INTCAST, IrTag.RET);
        assertThat(body.get(0).type()).isEqualTo(Types.U16);
        assertThat(((IrUnOp) body.get(1)).operand()).isSameAs(body.get(0));
    }

    @Test
    void testRuntimeIntegerIsNotNarrowed() {
        support.function("narrow", List.of(Types.U16), Types.U8, b -> b.ret(b.param(0)));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("expected u8, found u16");
    }

    @Test
    void testLiteralPassedAsVarArgIsReported() {
        support.module().declareExternFunction(support.file(), "printf",
                new FnType(List.of(), SimpleType.VOID, CallingConvention.C, true));
        support.function("main", List.of(), SimpleType.VOID, b -> {
            int printf = b.named(DECL_VAL, "printf");
            b.call(CALL, printf, b.intLit(1));
            b.ret(Ref.NONE);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("integer and float literals in var args function must be casted");
    }
}
