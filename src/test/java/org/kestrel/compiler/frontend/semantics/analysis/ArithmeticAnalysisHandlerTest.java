package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.frontend.semantics.SemaTestSupport;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.ir.IrBinOp;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Values;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kestrel.compiler.frontend.untyped.Tag.*;

@Tag("unit")
public class ArithmeticAnalysisHandlerTest {

    @Test
    void testComptimeOperandsFoldToPeerType() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> b.bin(ADD, b.bin(AS, Ref.U16_TYPE, b.intLit(1000)), b.intLit(24)));

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(Types.U16);
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(1024);
    }

    @Test
    void testComptimeOverflowIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.bin(ADD, b.bin(AS, Ref.U8_TYPE, b.intLit(200)), b.intLit(100)));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("overflow of integer type 'u8' with value '300'");
        assertThat(support.diagnostics().get(0).code()).isEqualTo(CompilerErrorCode.ARITHMETIC_FAULT);
    }

    @Test
    void testDivisionByZeroIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.bin(DIV, b.intLit(1), Ref.ZERO));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("division by zero");
    }

    @Test
    void testRuntimeOperandsAreCoercedToPeerType() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(Types.U8, Types.U16), Types.U16,
                b -> b.ret(b.bin(ADD, b.param(0), b.param(1))));

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.INTCAST, IrTag.ADD, IrTag.RET);
        IrBinOp add = (IrBinOp) body.get(1);
        assertThat(add.type()).isEqualTo(Types.U16);
        assertThat(add.lhs()).isSameAs(body.get(0));
    }

    @Test
    void testBooleanArithmeticIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.bin(ADD, Ref.BOOL_TRUE, Ref.BOOL_FALSE));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("invalid operands to binary expression: 'bool' and 'bool'");
    }

    @Test
    void testRuntimeShiftOfLiteralIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.function("f", List.of(Types.U8), Types.U8, b -> b.ret(b.bin(SHL, Ref.ONE, b.param(0))));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors())
                .containsExactly("LHS of shift must be an integer type, or RHS must be compile-time known");
    }

    @Test
    void testRuntimeShiftKeepsLhsType() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(Types.U32, Types.U8), Types.U32,
                b -> b.ret(b.bin(SHR, b.param(0), b.param(1))));

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.SHR, IrTag.RET);
        assertThat(body.get(0).type()).isEqualTo(Types.U32);
    }

    @Test
    void testBitNot() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> b.un(BIT_NOT, b.bin(AS, Ref.U8_TYPE, b.intLit(5))));
        support.declare("y", b -> b.un(BIT_NOT, Ref.BOOL_TRUE));

        assertThat(support.analyze()).isFalse();
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(250);
        assertThat(support.errors()).containsExactly("unable to perform binary not operation on type 'bool'");
    }

    @Test
    void testFloatLiteralArithmetic() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> b.bin(MUL, b.floatLit(1.5), b.bin(AS, Ref.F32_TYPE, b.floatLit(2.0))));

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(Types.F32);
        assertThat(Values.toDouble(x.typedValue().value())).isEqualTo(3.0);
    }

    @Test
    void testUndefinedOperandGivesUndefinedResult() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> b.bin(ADD, b.bin(AS, Ref.U8_TYPE, Ref.UNDEF), b.intLit(1)));

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(Types.U8);
        assertThat(x.typedValue().value().isUndef()).isTrue();
    }
}
