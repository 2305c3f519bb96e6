package org.kestrel.compiler.frontend.semantics.eval;

import org.kestrel.compiler.ir.IrTag;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.kestrel.compiler.frontend.untyped.Tag.*;

@Tag("unit")
public class NumericComparisonTest {

    @Test
    void testCompareMapsOrderingResult() {
        assertThat(NumericComparison.compare(CMP_LT, -1)).isTrue();
        assertThat(NumericComparison.compare(CMP_LT, 0)).isFalse();
        assertThat(NumericComparison.compare(CMP_LTE, 0)).isTrue();
        assertThat(NumericComparison.compare(CMP_EQ, 0)).isTrue();
        assertThat(NumericComparison.compare(CMP_NEQ, 0)).isFalse();
        assertThat(NumericComparison.compare(CMP_GTE, 1)).isTrue();
        assertThat(NumericComparison.compare(CMP_GT, 0)).isFalse();
    }

    @Test
    void testIrTagForEveryComparison() {
        assertThat(NumericComparison.irTag(CMP_LT)).isEqualTo(IrTag.CMP_LT);
        assertThat(NumericComparison.irTag(CMP_LTE)).isEqualTo(IrTag.CMP_LTE);
        assertThat(NumericComparison.irTag(CMP_EQ)).isEqualTo(IrTag.CMP_EQ);
        assertThat(NumericComparison.irTag(CMP_GTE)).isEqualTo(IrTag.CMP_GTE);
        assertThat(NumericComparison.irTag(CMP_GT)).isEqualTo(IrTag.CMP_GT);
        assertThat(NumericComparison.irTag(CMP_NEQ)).isEqualTo(IrTag.CMP_NEQ);
    }

    @Test
    void testNonComparisonOpcodeIsRejected() {
        assertThatThrownBy(() -> NumericComparison.compare(ADD, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
