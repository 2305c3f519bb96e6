package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.frontend.semantics.SemaTestSupport;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Values;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kestrel.compiler.frontend.untyped.Tag.*;

@Tag("unit")
public class CastAnalysisHandlerTest {

    @Test
    void testRuntimeIntCastNarrows() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(Types.U32), Types.U8,
                b -> b.ret(b.bin(INTCAST, Ref.U8_TYPE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.INTCAST, IrTag.RET);
        assertThat(body.get(0).type()).isEqualTo(Types.U8);
    }

    @Test
    void testIntCastToSameTypeIsNoOp() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(Types.U32), Types.U32,
                b -> b.ret(b.bin(INTCAST, Ref.U32_TYPE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.RET);
    }

    @Test
    void testComptimeIntCastChecksRange() {
        SemaTestSupport support = new SemaTestSupport();
        Decl ok = support.declare("ok", b -> b.bin(INTCAST, Ref.I8_TYPE, b.intLit(-128)));
        support.declare("bad", b -> b.bin(INTCAST, Ref.I8_TYPE, b.intLit(128)));

        assertThat(support.analyze()).isFalse();
        assertThat(Values.toLong(ok.typedValue().value())).isEqualTo(-128);
        assertThat(support.errors()).containsExactly("type i8 cannot represent integer value 128");
    }

    @Test
    void testRuntimeValueCannotBecomeComptimeInt() {
        SemaTestSupport support = new SemaTestSupport();
        support.function("f", List.of(Types.U32), SimpleType.VOID, b -> {
            b.bin(INTCAST, Ref.COMPTIME_INT_TYPE, b.param(0));
            b.ret(Ref.NONE);
        });

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("unable to cast runtime value to 'comptime_int'");
    }

    @Test
    void testIntCastOfFloatIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.bin(INTCAST, Ref.U8_TYPE, b.floatLit(1.0)));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("expected integer type, found 'comptime_float'");
    }

    @Test
    void testRuntimeFloatCast() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(Types.F64), Types.F32,
                b -> b.ret(b.bin(FLOATCAST, Ref.F32_TYPE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.FLOATCAST, IrTag.RET);
    }

    @Test
    void testRuntimeBitcast() {
        SemaTestSupport support = new SemaTestSupport();
        Decl f = support.function("f", List.of(Types.U32), Types.I32,
                b -> b.ret(b.bin(BITCAST, Ref.I32_TYPE, b.param(0))));

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.BITCAST, IrTag.RET);
        assertThat(body.get(0).type()).isEqualTo(Types.I32);
    }
}
