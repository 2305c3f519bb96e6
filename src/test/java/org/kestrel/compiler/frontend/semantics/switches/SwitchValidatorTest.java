package org.kestrel.compiler.frontend.semantics.switches;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.DiagnosticsEngine;
import org.kestrel.compiler.frontend.untyped.SpecialProng;
import org.kestrel.compiler.types.BoolValue;
import org.kestrel.compiler.types.EnumLiteralValue;
import org.kestrel.compiler.types.IntValue;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SwitchValidator}, called directly with resolved case values.
 */
@Tag("unit")
public class SwitchValidatorTest {

    private static final SourceInfo SWITCH = new SourceInfo("main.kes", 1, 1);

    private DiagnosticsEngine diagnostics;
    private SwitchValidator validator;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        validator = new SwitchValidator(diagnostics);
    }

    private static SwitchValidator.Item item(long value, int line) {
        return new SwitchValidator.Item(IntValue.of(value), new SourceInfo("main.kes", line, 5));
    }

    private static SwitchValidator.ItemRange range(long first, long last) {
        return new SwitchValidator.ItemRange(IntValue.of(first), IntValue.of(last), new SourceInfo("main.kes", 9, 5));
    }

    @Test
    void testItemsAndRangesTogetherCoverU8() {
        assertThatCode(() -> validator.validate(Types.U8, List.of(item(0, 2), item(255, 3)),
                List.of(range(1, 100), range(101, 254)), SpecialProng.NONE, SWITCH))
                .doesNotThrowAnyException();
    }

    @Test
    void testGapBetweenRangesIsNotExhaustive() {
        assertThatThrownBy(() -> validator.validate(Types.U8, List.of(),
                List.of(range(0, 100), range(102, 255)), SpecialProng.NONE, SWITCH))
                .isInstanceOf(SemanticException.class)
                .hasMessage("switch must handle all possibilities");
    }

    /**
     * Verifies that the duplicate is reported at the second occurrence.
     */
    @Test
    void testItemInsideRangeIsDuplicate() {
        assertThatThrownBy(() -> validator.validate(Types.I32, List.of(item(50, 4)),
                List.of(range(0, 100)), SpecialProng.ELSE, SWITCH))
                .isInstanceOf(SemanticException.class)
                .hasMessage("duplicate switch value");
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.code()).isEqualTo(CompilerErrorCode.DUPLICATE_SWITCH_VALUE));
    }

    @Test
    void testEmptyRangeIsRejected() {
        assertThatThrownBy(() -> validator.validate(Types.U8, List.of(), List.of(range(5, 5)), SpecialProng.ELSE, SWITCH))
                .hasMessage("range start value must be smaller than the end value");
    }

    @Test
    void testComptimeIntNeedsElse() {
        assertThatThrownBy(() -> validator.validate(SimpleType.COMPTIME_INT, List.of(item(1, 2)), List.of(),
                SpecialProng.NONE, SWITCH))
                .hasMessage("switch must handle all possibilities");
    }

    @Test
    void testBoolWithBothValuesIsExhaustive() {
        List<SwitchValidator.Item> items = List.of(
                new SwitchValidator.Item(BoolValue.TRUE, SWITCH),
                new SwitchValidator.Item(BoolValue.FALSE, SWITCH));

        assertThatCode(() -> validator.validate(SimpleType.BOOL, items, List.of(), SpecialProng.NONE, SWITCH))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validate(SimpleType.BOOL, items, List.of(), SpecialProng.ELSE, SWITCH))
                .hasMessage("unreachable else prong, all cases already handled");
    }

    @Test
    void testEnumLiteralRequiresElse() {
        List<SwitchValidator.Item> items = List.of(new SwitchValidator.Item(new EnumLiteralValue("a"), SWITCH));

        assertThatThrownBy(() -> validator.validate(SimpleType.ENUM_LITERAL, items, List.of(), SpecialProng.NONE,
                SWITCH))
                .hasMessage("else prong required when switching on type '@Type(.EnumLiteral)'");
    }

    @Test
    void testRangesOnBoolAreRejected() {
        assertThatThrownBy(() -> validator.checkTarget(SimpleType.BOOL, SpecialProng.ELSE, SWITCH, SWITCH))
                .hasMessage("ranges not allowed when switching on type bool");
    }

    @Test
    void testUnderscoreProngNeedsEnum() {
        assertThatThrownBy(() -> validator.checkTarget(Types.U8, SpecialProng.UNDERSCORE, null, SWITCH))
                .hasMessage("'_' prong only allowed when switching on non-exhaustive enums");
    }
}
