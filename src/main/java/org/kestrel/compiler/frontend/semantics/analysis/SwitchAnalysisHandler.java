package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.SafetyChecks;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.semantics.switches.SwitchValidator;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.SpecialProng;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.frontend.untyped.UntypedCode;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrBody;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrNoOp;
import org.kestrel.compiler.ir.IrSwitchBr;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the semantic analysis of switches.
 * <p>
 * Case items are coerced to the target type and validated before any prong body is analyzed. A
 * compile-time-known target analyzes only the matching prong, directly into the current block.
 */
public class SwitchAnalysisHandler implements IInstructionHandler {

    /**
     * A case with its items resolved to values.
     */
    private record ResolvedCase(List<Value> items, List<IrSwitchBr.Range> ranges, int[] body) {}

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        SourceInfo source = instruction.source();
        UntypedCode.SwitchBrPayload payload =
                block.code().readSwitchBr(instruction.data(InstData.PlNode.class).payloadIndex());

        IrInst target = sema.resolveInst(block, payload.target());
        if (instruction.tag() == Tag.SWITCHBR_REF) {
            target = sema.analyzeDeref(block, source, target);
        }
        Type targetType = target.type();
        sema.switchValidator().checkTarget(targetType, payload.specialProng(), firstRangeSource(sema, block, payload),
                source);

        List<ResolvedCase> cases = new ArrayList<>(payload.cases().size());
        List<SwitchValidator.Item> items = new ArrayList<>();
        List<SwitchValidator.ItemRange> ranges = new ArrayList<>();
        for (UntypedCode.SwitchCase switchCase : payload.cases()) {
            List<Value> caseItems = new ArrayList<>();
            for (int ref : switchCase.items()) {
                IrInst item = sema.coerce(block, targetType, sema.resolveInst(block, ref));
                Value value = sema.resolveConstValue(item);
                caseItems.add(value);
                items.add(new SwitchValidator.Item(value, item.source()));
            }
            List<IrSwitchBr.Range> caseRanges = new ArrayList<>();
            for (int i = 0; i < switchCase.rangeCount(); i++) {
                IrInst first = sema.coerce(block, targetType, sema.resolveInst(block, switchCase.ranges()[2 * i]));
                IrInst last = sema.coerce(block, targetType, sema.resolveInst(block, switchCase.ranges()[2 * i + 1]));
                Value firstValue = sema.resolveConstValue(first);
                Value lastValue = sema.resolveConstValue(last);
                caseRanges.add(new IrSwitchBr.Range(firstValue, lastValue));
                ranges.add(new SwitchValidator.ItemRange(firstValue, lastValue, first.source()));
            }
            cases.add(new ResolvedCase(caseItems, caseRanges, switchCase.body()));
        }
        sema.switchValidator().validate(targetType, items, ranges, payload.specialProng(), source);

        Value targetValue = sema.resolveDefinedValue(target);
        if (targetValue != null || cases.isEmpty()) {
            sema.analyzeBody(block, selectBody(targetValue, cases, payload.elseBody()));
            return sema.constNoReturn(block, source);
        }

        Block b = sema.requireRuntimeBlock(block, source);
        List<IrSwitchBr.Case> irCases = new ArrayList<>(cases.size());
        for (ResolvedCase resolved : cases) {
            Block caseBlock = b.makeSubBlock();
            sema.analyzeBody(caseBlock, resolved.body());
            irCases.add(new IrSwitchBr.Case(resolved.items(), resolved.ranges(),
                    new IrBody(caseBlock.instructions())));
        }
        Block elseBlock = b.makeSubBlock();
        if (payload.specialProng() == SpecialProng.NONE) {
            // Every value is handled, so the else path is never taken.
            if (sema.wantSafety()) {
                SafetyChecks.panic(elseBlock, source, SafetyChecks.PanicId.UNREACH);
            } else {
                elseBlock.add(new IrNoOp(IrTag.UNREACH, SimpleType.NO_RETURN, source));
            }
        } else {
            sema.analyzeBody(elseBlock, payload.elseBody());
        }
        return b.add(new IrSwitchBr(target, irCases, new IrBody(elseBlock.instructions()), source));
    }

    private SourceInfo firstRangeSource(Sema sema, Block block, UntypedCode.SwitchBrPayload payload) {
        for (UntypedCode.SwitchCase switchCase : payload.cases()) {
            if (switchCase.rangeCount() > 0) {
                return sema.resolveInst(block, switchCase.ranges()[0]).source();
            }
        }
        return null;
    }

    private int[] selectBody(Value target, List<ResolvedCase> cases, int[] elseBody) {
        if (target == null) {
            return elseBody;
        }
        for (ResolvedCase resolved : cases) {
            for (Value item : resolved.items()) {
                if (matches(target, item)) {
                    return resolved.body();
                }
            }
            for (IrSwitchBr.Range range : resolved.ranges()) {
                if (Values.compareNumeric(target, range.first()) >= 0
                        && Values.compareNumeric(target, range.last()) <= 0) {
                    return resolved.body();
                }
            }
        }
        return elseBody;
    }

    private boolean matches(Value target, Value item) {
        if (Values.isNumeric(target) && Values.isNumeric(item)) {
            return Values.compareNumeric(target, item) == 0;
        }
        return target.equals(item);
    }
}
