package org.kestrel.compiler.frontend.untyped;

import org.kestrel.compiler.api.SourceInfo;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable untyped instruction stream: the body of one function or one declaration value.
 * <p>
 * Variable-length operands live in {@link #extra()}; the {@code read*} methods decode them.
 *
 * @param fileName     The source file, for diagnostics.
 * @param instructions The instructions, indexed from 0.
 * @param extra        Payload words referenced by {@link InstData.PlNode}.
 * @param strings      UTF-8 bytes referenced by {@link InstData.Str} and {@link InstData.StrOp}; their
 *                     {@code start} and {@code len} count bytes.
 * @param rootBody     Instruction indices of the top-level body.
 * @param paramCount   Number of parameter refs.
 */
public record UntypedCode(String fileName, List<UntypedInstruction> instructions, int[] extra, byte[] strings,
                          int[] rootBody, int paramCount) {

    public UntypedCode {
        instructions = List.copyOf(instructions);
    }

    public UntypedInstruction instruction(int index) {
        return instructions.get(index);
    }

    public int paramRef(int paramIndex) {
        return Ref.BUILTIN_COUNT + paramIndex;
    }

    public int instRef(int instIndex) {
        return Ref.BUILTIN_COUNT + paramCount + instIndex;
    }

    public boolean isParamRef(int ref) {
        return ref >= Ref.BUILTIN_COUNT && ref < Ref.BUILTIN_COUNT + paramCount;
    }

    /**
     * @param ref A ref naming an instruction.
     * @return The instruction index.
     */
    public int refToIndex(int ref) {
        int index = ref - Ref.BUILTIN_COUNT - paramCount;
        if (index < 0 || index >= instructions.size()) {
            throw new IllegalArgumentException("ref " + ref + " names no instruction");
        }
        return index;
    }

    public SourceInfo source(int instIndex) {
        return instructions.get(instIndex).source();
    }

    /**
     * @return The bytes decoded as UTF-8, for names.
     */
    public String string(int start, int len) {
        return new String(strings, start, len, StandardCharsets.UTF_8);
    }

    public String string(InstData.Str str) {
        return string(str.start(), str.len());
    }

    public String string(InstData.StrOp str) {
        return string(str.start(), str.len());
    }

    /**
     * @return A copy of the literal's raw bytes.
     */
    public byte[] bytes(InstData.Str str) {
        return Arrays.copyOfRange(strings, str.start(), str.start() + str.len());
    }

    // region payloads

    /** Payload of {@link Tag#CONDBR}. */
    public record CondBrPayload(int condition, int[] thenBody, int[] elseBody) {}

    /** Payload of the call opcodes. */
    public record CallPayload(int callee, CallModifier modifier, int[] args) {}

    /** Payload of {@link Tag#FN_TYPE} and {@link Tag#FN_TYPE_CC}; {@code cc} is {@link Ref#NONE} for the former. */
    public record FnTypePayload(int cc, boolean varArgs, int returnType, int[] paramTypes) {}

    /** Payload of {@link Tag#ARRAY_TYPE_SENTINEL}. */
    public record ArrayTypeSentinel(int len, int sentinel, int elemType) {}

    /**
     * One prong of a switch.
     *
     * @param items  Refs of single values.
     * @param ranges Refs of inclusive ranges, as {@code first, last} pairs.
     * @param body   Instruction indices.
     */
    public record SwitchCase(int[] items, int[] ranges, int[] body) {

        public int rangeCount() {
            return ranges.length / 2;
        }
    }

    /** Payload of {@link Tag#SWITCHBR} and {@link Tag#SWITCHBR_REF}. */
    public record SwitchBrPayload(int target, SpecialProng specialProng, List<SwitchCase> cases, int[] elseBody) {}

    /**
     * @return The body of a block or loop.
     */
    public int[] readBody(int payloadIndex) {
        int len = extra[payloadIndex];
        return slice(payloadIndex + 1, len);
    }

    public CondBrPayload readCondBr(int payloadIndex) {
        int cond = extra[payloadIndex];
        int thenLen = extra[payloadIndex + 1];
        int elseLen = extra[payloadIndex + 2];
        int[] thenBody = slice(payloadIndex + 3, thenLen);
        int[] elseBody = slice(payloadIndex + 3 + thenLen, elseLen);
        return new CondBrPayload(cond, thenBody, elseBody);
    }

    public CallPayload readCall(int payloadIndex) {
        int callee = extra[payloadIndex];
        CallModifier modifier = CallModifier.values()[extra[payloadIndex + 1]];
        int argsLen = extra[payloadIndex + 2];
        return new CallPayload(callee, modifier, slice(payloadIndex + 3, argsLen));
    }

    /**
     * @return The operand refs of a multi-operand instruction.
     */
    public int[] readMultiOp(int payloadIndex) {
        return slice(payloadIndex + 1, extra[payloadIndex]);
    }

    public FnTypePayload readFnType(int payloadIndex) {
        int cc = extra[payloadIndex];
        boolean varArgs = extra[payloadIndex + 1] != 0;
        int returnType = extra[payloadIndex + 2];
        int paramsLen = extra[payloadIndex + 3];
        return new FnTypePayload(cc, varArgs, returnType, slice(payloadIndex + 4, paramsLen));
    }

    /**
     * @return The names in source order, duplicates included.
     */
    public List<String> readErrorSet(int payloadIndex) {
        int namesLen = extra[payloadIndex];
        List<String> names = new ArrayList<>(namesLen);
        for (int i = 0; i < namesLen; i++) {
            int at = payloadIndex + 1 + i * 2;
            names.add(string(extra[at], extra[at + 1]));
        }
        return names;
    }

    public ArrayTypeSentinel readArrayTypeSentinel(int payloadIndex) {
        return new ArrayTypeSentinel(extra[payloadIndex], extra[payloadIndex + 1], extra[payloadIndex + 2]);
    }

    public SwitchBrPayload readSwitchBr(int payloadIndex) {
        int at = payloadIndex;
        int target = extra[at++];
        SpecialProng special = SpecialProng.values()[extra[at++]];
        int casesLen = extra[at++];
        List<SwitchCase> cases = new ArrayList<>(casesLen);
        for (int i = 0; i < casesLen; i++) {
            int itemsLen = extra[at++];
            int rangesLen = extra[at++];
            int bodyLen = extra[at++];
            int[] items = slice(at, itemsLen);
            at += itemsLen;
            int[] ranges = slice(at, rangesLen * 2);
            at += rangesLen * 2;
            int[] body = slice(at, bodyLen);
            at += bodyLen;
            cases.add(new SwitchCase(items, ranges, body));
        }
        int elseLen = extra[at++];
        return new SwitchBrPayload(target, special, cases, slice(at, elseLen));
    }

    // endregion

    private int[] slice(int from, int len) {
        return Arrays.copyOfRange(extra, from, from + len);
    }
}
