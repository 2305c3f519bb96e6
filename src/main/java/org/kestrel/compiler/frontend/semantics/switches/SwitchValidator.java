package org.kestrel.compiler.frontend.semantics.switches;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.diagnostics.DiagnosticsSink;
import org.kestrel.compiler.frontend.untyped.SpecialProng;
import org.kestrel.compiler.types.IntType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks switch prongs for duplicates and exhaustiveness before the switch is lowered.
 * <p>
 * Integer targets are checked with a {@link RangeSet}; bools by counting; targets without a natural
 * enumeration need an else prong and are checked for duplicates by value equality.
 */
public final class SwitchValidator {

    /**
     * A compile-time-known case item, already coerced to the target type.
     */
    public record Item(Value value, SourceInfo source) {}

    /**
     * A compile-time-known case range, already coerced to the target type.
     */
    public record ItemRange(Value first, Value last, SourceInfo source) {}

    private final DiagnosticsSink sink;

    public SwitchValidator(DiagnosticsSink sink) {
        this.sink = sink;
    }

    /**
     * @param targetType The type switched on.
     * @param items      The single-value items of every case.
     * @param ranges     The ranges of every case.
     * @param special    The kind of the catch-all prong.
     * @param source     The location of the switch.
     * @throws SemanticException if a value is covered twice, the prongs miss a value, or an else prong
     *                           is unreachable.
     */
    public void validate(Type targetType, List<Item> items, List<ItemRange> ranges, SpecialProng special,
                         SourceInfo source) throws SemanticException {
        checkTarget(targetType, special, ranges.isEmpty() ? null : ranges.get(0).source(), source);
        switch (targetType.kind()) {
            case INT:
            case COMPTIME_INT:
                validateInt(targetType, items, ranges, special, source);
                break;
            case BOOL:
                validateBool(items, special, source);
                break;
            default:
                validateByEquality(targetType, items, special, source);
                break;
        }
    }

    /**
     * Checks that the target type can be switched on with the given prong shapes, before any case item is
     * coerced to it.
     *
     * @param rangeSource The location of the first range, or {@code null} if the switch has no ranges.
     */
    public void checkTarget(Type targetType, SpecialProng special, SourceInfo rangeSource, SourceInfo source)
            throws SemanticException {
        TypeKind kind = targetType.kind();
        if (special == SpecialProng.UNDERSCORE && kind != TypeKind.ENUM) {
            throw sink.fail(source, "'_' prong only allowed when switching on non-exhaustive enums");
        }
        if (rangeSource != null && kind != TypeKind.INT && kind != TypeKind.COMPTIME_INT) {
            throw sink.fail(rangeSource, CompilerErrorCode.INVALID_SWITCH_TARGET,
                    "ranges not allowed when switching on type %s", targetType);
        }
        switch (kind) {
            case INT:
            case COMPTIME_INT:
            case BOOL:
            case ENUM_LITERAL:
            case VOID:
            case FN:
            case POINTER:
            case TYPE:
                return;
            case ENUM:
            case ERROR_SET:
            case UNION:
                throw sink.fail(source, CompilerErrorCode.NOT_IMPLEMENTED,
                        "TODO validateSwitch %s", kind.name().toLowerCase());
            default:
                throw sink.fail(source, CompilerErrorCode.INVALID_SWITCH_TARGET,
                        "invalid switch target type '%s'", targetType);
        }
    }

    private void validateInt(Type targetType, List<Item> items, List<ItemRange> ranges, SpecialProng special,
                             SourceInfo source) throws SemanticException {
        RangeSet seen = new RangeSet();
        for (Item item : items) {
            BigInteger value = Values.toBigInteger(item.value());
            addOrFail(seen, value, value, item.source());
        }
        for (ItemRange range : ranges) {
            BigInteger first = Values.toBigInteger(range.first());
            BigInteger last = Values.toBigInteger(range.last());
            if (first.compareTo(last) >= 0) {
                throw sink.fail(range.source(), "range start value must be smaller than the end value");
            }
            addOrFail(seen, first, last, range.source());
        }

        if (targetType instanceof IntType intType && seen.spans(intType.minValue(), intType.maxValue())) {
            if (special == SpecialProng.ELSE) {
                throw sink.fail(source, CompilerErrorCode.UNREACHABLE_ELSE_PRONG,
                        "unreachable else prong, all cases already handled");
            }
            return;
        }
        if (special != SpecialProng.ELSE) {
            throw sink.fail(source, CompilerErrorCode.NON_EXHAUSTIVE_SWITCH, "switch must handle all possibilities");
        }
    }

    private void addOrFail(RangeSet seen, BigInteger first, BigInteger last, SourceInfo source)
            throws SemanticException {
        RangeSet.Range previous = seen.add(first, last, source);
        if (previous != null) {
            CompilerLogger.debug("switch value at {} overlaps the value at {}", source, previous.source());
            throw sink.fail(source, CompilerErrorCode.DUPLICATE_SWITCH_VALUE, "duplicate switch value");
        }
    }

    private void validateBool(List<Item> items, SpecialProng special, SourceInfo source) throws SemanticException {
        boolean seenTrue = false;
        boolean seenFalse = false;
        for (Item item : items) {
            boolean value = Values.toBool(item.value());
            if (value ? seenTrue : seenFalse) {
                throw sink.fail(item.source(), CompilerErrorCode.DUPLICATE_SWITCH_VALUE, "duplicate switch value");
            }
            if (value) {
                seenTrue = true;
            } else {
                seenFalse = true;
            }
        }
        boolean all = seenTrue && seenFalse;
        if (special == SpecialProng.ELSE && all) {
            throw sink.fail(source, CompilerErrorCode.UNREACHABLE_ELSE_PRONG,
                    "unreachable else prong, all cases already handled");
        }
        if (special == SpecialProng.NONE && !all) {
            throw sink.fail(source, CompilerErrorCode.NON_EXHAUSTIVE_SWITCH, "switch must handle all possibilities");
        }
    }

    private void validateByEquality(Type targetType, List<Item> items, SpecialProng special, SourceInfo source)
            throws SemanticException {
        if (special != SpecialProng.ELSE) {
            throw sink.fail(source, CompilerErrorCode.NON_EXHAUSTIVE_SWITCH,
                    "else prong required when switching on type '%s'", targetType);
        }
        Map<Value, SourceInfo> seen = new HashMap<>();
        for (Item item : items) {
            if (seen.putIfAbsent(item.value(), item.source()) != null) {
                throw sink.fail(item.source(), CompilerErrorCode.DUPLICATE_SWITCH_VALUE, "duplicate switch value");
            }
        }
    }
}
