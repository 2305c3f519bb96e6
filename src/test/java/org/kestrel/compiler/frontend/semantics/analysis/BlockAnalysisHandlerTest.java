package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.frontend.semantics.SemaTestSupport;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.ir.IrArg;
import org.kestrel.compiler.ir.IrBinOp;
import org.kestrel.compiler.ir.IrBlock;
import org.kestrel.compiler.ir.IrBr;
import org.kestrel.compiler.ir.IrCondBr;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.module.Decl;
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
 * Contains unit tests for block, break, loop and conditional branch lowering.
 */
@Tag("unit")
public class BlockAnalysisHandlerTest {

    private SemaTestSupport support;

    @BeforeEach
    void setUp() {
        support = new SemaTestSupport();
    }

    /**
     * Verifies that a block whose only break ends its body is dissolved into the parent and
     * evaluates to the break operand.
     */
    @Test
    void testSingleTrailingBreakIsFlattened() {
        Decl f = support.function("f", List.of(Types.I32), Types.I32, b -> {
            int result = b.block(self -> b.brk(self, b.param(0)));
            b.ret(result);
        });

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.RET);
        assertThat(((IrUnOp) body.get(0)).operand()).isInstanceOf(IrArg.class);
    }

    /**
     * Verifies that breaks of different integer types produce a block of the peer type and that the
     * narrower break operand is widened inside a flat coercion body.
     */
    @Test
    void testBreaksOfDifferentTypesArePeerResolved() {
        Decl f = support.function("pick", List.of(SimpleType.BOOL, Types.I8, Types.I32), Types.I32, b -> {
            int result = b.block(self -> b.condbr(b.param(0),
                    () -> b.brk(self, b.param(1)),
                    () -> b.brk(self, b.param(2))));
            b.ret(result);
        });

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.BLOCK, IrTag.RET);

        IrBlock block = (IrBlock) body.get(0);
        assertThat(block.type()).isEqualTo(Types.I32);
        IrCondBr condBr = (IrCondBr) block.body().instructions().get(0);

        IrBr thenBreak = (IrBr) condBr.thenBody().last();
        assertThat(thenBreak.tag()).isEqualTo(IrTag.BR_BLOCK_FLAT);
        assertThat(thenBreak.coercionBody().instructions()).extracting(IrInst::tag).containsExactly(IrTag.INTCAST);
        assertThat(thenBreak.operand().type()).isEqualTo(Types.I32);

        IrBr elseBreak = (IrBr) condBr.elseBody().last();
        assertThat(elseBreak.tag()).isEqualTo(IrTag.BR);
        assertThat(elseBreak.operand()).isInstanceOf(IrArg.class);
    }

    @Test
    void testComptimeConditionSelectsOneBody() {
        Decl x = support.declare("x", b -> b.block(self -> b.condbr(Ref.BOOL_FALSE,
                () -> b.brk(self, b.intLit(1)),
                () -> b.brk(self, b.intLit(2)))));

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(SimpleType.COMPTIME_INT);
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(2L);
    }

    /**
     * Verifies that the body not taken by a compile-time condition is never analyzed.
     */
    @Test
    void testBodyNotTakenIsNotAnalyzed() {
        Decl x = support.declare("x", b -> b.block(self -> b.condbr(Ref.BOOL_TRUE,
                () -> b.brk(self, b.intLit(1)),
                () -> b.brk(self, b.bin(ADD, Ref.BOOL_TRUE, Ref.BOOL_TRUE)))));

        assertThat(support.analyze()).isTrue();
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(1L);
    }

    @Test
    void testFlatBlockSplicesIntoParent() {
        Decl f = support.function("f", List.of(Types.U32), Types.U32, b -> {
            int sum = b.blockLike(BLOCK_FLAT, self -> b.bin(ADD, b.param(0), Ref.ONE));
            b.ret(sum);
        });

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.ADD, IrTag.RET);
    }

    @Test
    void testLoopExitedByBreakBecomesVoidBlock() {
        Decl f = support.function("spin", List.of(), SimpleType.VOID, b -> {
            b.block(self -> b.loop(loop -> b.breakVoid(self)));
            b.ret(Ref.NONE);
        });

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.BLOCK, IrTag.RETVOID);
        assertThat(body.get(0).type()).isEqualTo(SimpleType.VOID);
        assertThat(((IrBlock) body.get(0)).body().instructions()).extracting(IrInst::tag)
                .containsExactly(IrTag.LOOP);
    }

    /**
     * Verifies that analysis of a body stops after the first instruction that never returns.
     */
    @Test
    void testInstructionsAfterReturnAreNotAnalyzed() {
        Decl f = support.function("early", List.of(), SimpleType.VOID, b -> {
            b.ret(Ref.NONE);
            b.bin(ADD, Ref.BOOL_TRUE, Ref.BOOL_TRUE);
        });

        assertThat(support.analyze()).isTrue();
        assertThat(support.body(f)).extracting(IrInst::tag).containsExactly(IrTag.RETVOID);
    }

    /**
     * Verifies that every reference to an instruction resolves to the same analyzed result.
     */
    @Test
    void testReferencesResolveToTheSameResult() {
        Decl f = support.function("square", List.of(Types.I32), Types.I32, b -> {
            int sum = b.bin(ADD, b.param(0), Ref.ONE);
            b.ret(b.bin(MUL, sum, sum));
        });

        assertThat(support.analyze()).isTrue();
        List<IrInst> body = support.body(f);
        assertThat(body).extracting(IrInst::tag).containsExactly(IrTag.ADD, IrTag.MUL, IrTag.RET);
        IrBinOp mul = (IrBinOp) body.get(1);
        assertThat(mul.lhs()).isSameAs(body.get(0));
        assertThat(mul.rhs()).isSameAs(body.get(0));
    }

    @Test
    void testBreakInDeclarationIsEvaluatedAtCompileTime() {
        Decl x = support.declare("x", b -> b.block(self -> b.brk(self, b.intLit(3))));

        assertThat(support.analyze()).isTrue();
        assertThat(Values.toLong(x.typedValue().value())).isEqualTo(3L);
    }
}
