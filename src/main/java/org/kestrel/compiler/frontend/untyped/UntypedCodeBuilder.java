package org.kestrel.compiler.frontend.untyped;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.PointerType;
import org.kestrel.compiler.types.Signedness;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Programmatic producer of {@link UntypedCode}.
 * <p>
 * Every emitting method appends one instruction to the body currently being written and returns
 * its {@link Ref}. Nested bodies are written by callbacks: while a callback runs, emitted
 * instructions go to the nested body. Block-like callbacks receive the instruction index of the
 * block so that breaks can target it.
 * <pre>{@code
 * UntypedCodeBuilder b = UntypedCodeBuilder.forFunction("main.kes", 1);
 * int result = b.block(self -> b.brk(self, b.param(0)));
 * b.ret(result);
 * UntypedCode code = b.build();
 * }</pre>
 */
public final class UntypedCodeBuilder {

    private final String fileName;
    private final int paramCount;
    private final List<UntypedInstruction> instructions = new ArrayList<>();
    private final IntArrayList extra = new IntArrayList();
    private final ByteArrayList strings = new ByteArrayList();
    private final Deque<IntArrayList> bodies = new ArrayDeque<>();
    private final IntArrayList rootBody = new IntArrayList();
    private int line = -1;

    private UntypedCodeBuilder(String fileName, int paramCount) {
        this.fileName = fileName;
        this.paramCount = paramCount;
        bodies.push(rootBody);
    }

    /**
     * @param fileName   The source file name used in source locations.
     * @param paramCount The number of parameters the body can reference.
     */
    public static UntypedCodeBuilder forFunction(String fileName, int paramCount) {
        return new UntypedCodeBuilder(fileName, paramCount);
    }

    /**
     * @param fileName The source file name used in source locations.
     */
    public static UntypedCodeBuilder forDecl(String fileName) {
        return new UntypedCodeBuilder(fileName, 0);
    }

    /**
     * Sets the line of the following instructions. Without it, an instruction's line is its index plus one.
     */
    public UntypedCodeBuilder at(int lineNumber) {
        this.line = lineNumber;
        return this;
    }

    public int param(int index) {
        if (index < 0 || index >= paramCount) {
            throw new IllegalArgumentException("parameter index out of range: " + index);
        }
        return Ref.BUILTIN_COUNT + index;
    }

    /**
     * @param ref A ref returned by this builder.
     * @return The instruction index, as needed by {@link #brk}.
     */
    public int indexOf(int ref) {
        return ref - Ref.BUILTIN_COUNT - paramCount;
    }

    // region constants

    public int intLit(long value) {
        return intLit(BigInteger.valueOf(value));
    }

    public int intLit(BigInteger value) {
        return emit(Tag.INT, new InstData.Int(value));
    }

    public int floatLit(double value) {
        return emit(Tag.FLOAT, new InstData.Float(value));
    }

    public int str(String value) {
        return emit(Tag.STR, string(value));
    }

    public int enumLiteral(String name) {
        return emit(Tag.ENUM_LITERAL, string(name));
    }

    public int voidValue() {
        return emit(Tag.VOID_VALUE, new InstData.Node());
    }

    // endregion

    // region generic shapes

    public int bin(Tag tag, int lhs, int rhs) {
        return emit(tag, new InstData.Bin(lhs, rhs));
    }

    public int un(Tag tag, int operand) {
        return emit(tag, new InstData.UnNode(operand));
    }

    public int node(Tag tag) {
        return emit(tag, new InstData.Node());
    }

    public int named(Tag tag, String name) {
        return emit(tag, string(name));
    }

    public int namedOp(Tag tag, int operand, String name) {
        InstData.Str s = string(name);
        return emit(tag, new InstData.StrOp(s.start(), s.len(), operand));
    }

    /**
     * Emits an instruction with an operand list, such as {@link Tag#COMPILE_LOG} or {@link Tag#TYPEOF_PEER}.
     */
    public int multiOp(Tag tag, int... operands) {
        int payload = extra.size();
        extra.add(operands.length);
        extra.addElements(extra.size(), operands);
        return emit(tag, new InstData.PlNode(payload));
    }

    // endregion

    // region types

    public int intType(Signedness signedness, int bits) {
        return emit(Tag.INT_TYPE, new InstData.IntType(signedness, bits));
    }

    public int ptrType(int elemType, PointerType.Size size, boolean mutable) {
        return emit(Tag.PTR_TYPE_SIMPLE, new InstData.PtrTypeSimple(elemType, size, mutable, false, false));
    }

    public int arrayTypeSentinel(int len, int sentinel, int elemType) {
        int payload = extra.size();
        extra.add(len);
        extra.add(sentinel);
        extra.add(elemType);
        return emit(Tag.ARRAY_TYPE_SENTINEL, new InstData.PlNode(payload));
    }

    public int errorSet(String... names) {
        int payload = extra.size();
        extra.add(names.length);
        for (String name : names) {
            InstData.Str s = string(name);
            extra.add(s.start());
            extra.add(s.len());
        }
        return emit(Tag.ERROR_SET, new InstData.PlNode(payload));
    }

    /**
     * @param cc A ref to an enum literal naming the calling convention, or {@link Ref#NONE}.
     */
    public int fnType(int cc, boolean varArgs, int returnType, int... paramTypes) {
        int payload = extra.size();
        extra.add(cc);
        extra.add(varArgs ? 1 : 0);
        extra.add(returnType);
        extra.add(paramTypes.length);
        extra.addElements(extra.size(), paramTypes);
        return emit(cc == Ref.NONE ? Tag.FN_TYPE : Tag.FN_TYPE_CC, new InstData.PlNode(payload));
    }

    public int paramType(int callee, int paramIndex) {
        return emit(Tag.PARAM_TYPE, new InstData.ParamType(callee, paramIndex));
    }

    // endregion

    // region control flow

    /**
     * Emits a {@link Tag#BLOCK}.
     *
     * @param body Writes the body; receives the block's instruction index.
     */
    public int block(IntConsumer body) {
        return blockLike(Tag.BLOCK, body);
    }

    /**
     * Emits a block-like instruction: one of the block opcodes or {@link Tag#LOOP}.
     */
    public int blockLike(Tag tag, IntConsumer body) {
        int index = reserve(tag);
        IntArrayList nested = nestedBody(() -> body.accept(index));
        int payload = extra.size();
        extra.add(nested.size());
        extra.addAll(nested);
        return complete(index, tag, new InstData.PlNode(payload));
    }

    public int loop(IntConsumer body) {
        return blockLike(Tag.LOOP, body);
    }

    /**
     * @param blockInst The instruction index of the target block.
     * @param operand   The result.
     */
    public int brk(int blockInst, int operand) {
        return emit(Tag.BREAK, new InstData.Break(blockInst, operand));
    }

    public int breakVoid(int blockInst) {
        return emit(Tag.BREAK_VOID, new InstData.Break(blockInst, Ref.NONE));
    }

    public int condbr(int condition, Runnable thenBody, Runnable elseBody) {
        int index = reserve(Tag.CONDBR);
        IntArrayList thenInsts = nestedBody(thenBody);
        IntArrayList elseInsts = nestedBody(elseBody);
        int payload = extra.size();
        extra.add(condition);
        extra.add(thenInsts.size());
        extra.add(elseInsts.size());
        extra.addAll(thenInsts);
        extra.addAll(elseInsts);
        return complete(index, Tag.CONDBR, new InstData.PlNode(payload));
    }

    /**
     * A prong for {@link #switchBr}.
     *
     * @param items  Refs of single values.
     * @param ranges Refs of inclusive ranges as {@code first, last} pairs.
     * @param body   Writes the prong body.
     */
    public record Prong(int[] items, int[] ranges, Runnable body) {

        public static Prong of(Runnable body, int... items) {
            return new Prong(items, new int[0], body);
        }

        public static Prong range(int first, int last, Runnable body) {
            return new Prong(new int[0], new int[] {first, last}, body);
        }
    }

    /**
     * @param elseBody Writes the else body; may be {@code null} when {@code special} is {@link SpecialProng#NONE}.
     */
    public int switchBr(Tag tag, int target, SpecialProng special, List<Prong> prongs, Runnable elseBody) {
        int index = reserve(tag);
        List<IntArrayList> prongBodies = new ArrayList<>();
        for (Prong prong : prongs) {
            prongBodies.add(nestedBody(prong.body()));
        }
        IntArrayList elseInsts = elseBody == null ? new IntArrayList() : nestedBody(elseBody);
        int payload = extra.size();
        extra.add(target);
        extra.add(special.ordinal());
        extra.add(prongs.size());
        for (int i = 0; i < prongs.size(); i++) {
            Prong prong = prongs.get(i);
            IntArrayList body = prongBodies.get(i);
            extra.add(prong.items().length);
            extra.add(prong.ranges().length / 2);
            extra.add(body.size());
            extra.addElements(extra.size(), prong.items());
            extra.addElements(extra.size(), prong.ranges());
            extra.addAll(body);
        }
        extra.add(elseInsts.size());
        extra.addAll(elseInsts);
        return complete(index, tag, new InstData.PlNode(payload));
    }

    public int call(Tag tag, int callee, int... args) {
        int payload = extra.size();
        extra.add(callee);
        extra.add(CallModifier.forTag(tag).ordinal());
        extra.add(args.length);
        extra.addElements(extra.size(), args);
        return emit(tag, new InstData.PlNode(payload));
    }

    public int ret(int operand) {
        return un(Tag.RET, operand);
    }

    // endregion

    /**
     * @return The finished stream. The builder must not be used afterwards.
     */
    public UntypedCode build() {
        if (bodies.size() != 1) {
            throw new IllegalStateException("unterminated nested body");
        }
        return new UntypedCode(fileName, instructions, extra.toIntArray(), strings.toByteArray(),
                rootBody.toIntArray(), paramCount);
    }

    private InstData.Str string(String value) {
        int start = strings.size();
        byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
        strings.addElements(start, encoded);
        return new InstData.Str(start, encoded.length);
    }

    private int emit(Tag tag, InstData data) {
        int index = reserve(tag);
        return complete(index, tag, data);
    }

    private int reserve(Tag tag) {
        int index = instructions.size();
        int lineNumber = line > 0 ? line : index + 1;
        instructions.add(new UntypedInstruction(tag, new InstData.Node(), new SourceInfo(fileName, lineNumber, 1)));
        bodies.peek().add(index);
        return index;
    }

    private int complete(int index, Tag tag, InstData data) {
        SourceInfo source = instructions.get(index).source();
        instructions.set(index, new UntypedInstruction(tag, data, source));
        return Ref.BUILTIN_COUNT + paramCount + index;
    }

    private IntArrayList nestedBody(Runnable writer) {
        IntArrayList body = new IntArrayList();
        bodies.push(body);
        try {
            writer.run();
        } finally {
            bodies.pop();
        }
        return body;
    }
}
