package org.kestrel.compiler.ir;

import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Value;

import java.util.List;

/**
 * A runtime multi-way branch.
 */
public final class IrSwitchBr extends IrInst {

    /**
     * @param first The inclusive lower bound.
     * @param last  The inclusive upper bound.
     */
    public record Range(Value first, Value last) {}

    /**
     * One prong: taken when the target equals an item or lies within a range.
     */
    public record Case(List<Value> items, List<Range> ranges, IrBody body) {

        public Case {
            items = List.copyOf(items);
            ranges = List.copyOf(ranges);
        }
    }

    private final IrInst target;
    private final List<Case> cases;
    private final IrBody elseBody;

    public IrSwitchBr(IrInst target, List<Case> cases, IrBody elseBody, SourceInfo source) {
        super(IrTag.SWITCHBR, SimpleType.NO_RETURN, source);
        this.target = target;
        this.cases = List.copyOf(cases);
        this.elseBody = elseBody;
    }

    public IrInst target() {
        return target;
    }

    public List<Case> cases() {
        return cases;
    }

    public IrBody elseBody() {
        return elseBody;
    }
}
