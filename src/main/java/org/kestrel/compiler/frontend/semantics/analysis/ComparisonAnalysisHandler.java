package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.semantics.eval.NumericComparison;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrBinOp;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.ir.IrTag;
import org.kestrel.compiler.ir.IrUnOp;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.TypeKind;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Value;
import org.kestrel.compiler.types.Values;

/**
 * Handles the semantic analysis of comparisons and boolean logic.
 */
public class ComparisonAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        switch (instruction.tag()) {
            case BOOL_NOT:
                return analyzeBoolNot(sema, block, instruction);
            case BOOL_AND:
            case BOOL_OR:
                return analyzeBoolOp(sema, block, instruction);
            default:
                return analyzeCmp(sema, block, instruction);
        }
    }

    private IrInst analyzeCmp(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        Tag op = instruction.tag();
        SourceInfo source = instruction.source();
        InstData.Bin bin = instruction.data(InstData.Bin.class);
        IrInst lhs = sema.resolveInst(block, bin.lhs());
        IrInst rhs = sema.resolveInst(block, bin.rhs());
        TypeKind lhsKind = lhs.type().kind();
        TypeKind rhsKind = rhs.type().kind();
        boolean isEquality = op == Tag.CMP_EQ || op == Tag.CMP_NEQ;

        if (lhsKind == TypeKind.NULL && rhsKind == TypeKind.NULL) {
            return sema.constBool(block, source, op == Tag.CMP_EQ);
        }
        if (isEquality && lhsKind == TypeKind.NULL && rhsKind == TypeKind.OPTIONAL) {
            return sema.analyzeIsNull(block, source, rhs, op == Tag.CMP_NEQ);
        }
        if (isEquality && rhsKind == TypeKind.NULL && lhsKind == TypeKind.OPTIONAL) {
            return sema.analyzeIsNull(block, source, lhs, op == Tag.CMP_NEQ);
        }
        if (isEquality && (lhsKind == TypeKind.NULL || rhsKind == TypeKind.NULL)) {
            IrInst nonNull = lhsKind == TypeKind.NULL ? rhs : lhs;
            throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS, "comparison of '%s' with null", nonNull.type());
        }
        if (lhsKind == TypeKind.ERROR_SET && rhsKind == TypeKind.ERROR_SET) {
            if (!isEquality) {
                throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS, "%s operator not allowed for errors",
                        operatorName(op));
            }
            Value lhsValue = sema.resolveDefinedValue(lhs);
            Value rhsValue = sema.resolveDefinedValue(rhs);
            if (lhsValue != null && rhsValue != null) {
                boolean same = Values.getError(lhsValue).equals(Values.getError(rhsValue));
                return sema.constBool(block, source, same == (op == Tag.CMP_EQ));
            }
            throw sema.fail(source, CompilerErrorCode.NOT_IMPLEMENTED, "TODO implement runtime error set comparison");
        }
        if (lhsKind == TypeKind.TYPE && rhsKind == TypeKind.TYPE) {
            if (!isEquality) {
                throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS, "%s operator not allowed for types",
                        operatorName(op));
            }
            boolean same = Values.toType(sema.resolveConstValue(lhs)).equals(Values.toType(sema.resolveConstValue(rhs)));
            return sema.constBool(block, source, same == (op == Tag.CMP_EQ));
        }
        if (Types.isNumeric(lhs.type()) && Types.isNumeric(rhs.type())) {
            return sema.numericComparison().cmpNumeric(block, source, op, lhs, rhs);
        }
        if (lhsKind == TypeKind.BOOL && rhsKind == TypeKind.BOOL) {
            if (!isEquality) {
                throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS, "%s operator not allowed for bool",
                        operatorName(op));
            }
            Value lhsValue = lhs.value();
            Value rhsValue = rhs.value();
            if (lhsValue != null && rhsValue != null) {
                if (lhsValue.isUndef() || rhsValue.isUndef()) {
                    return sema.constUndef(block, source, SimpleType.BOOL);
                }
                boolean same = Values.toBool(lhsValue) == Values.toBool(rhsValue);
                return sema.constBool(block, source, same == (op == Tag.CMP_EQ));
            }
            Block b = sema.requireRuntimeBlock(block, source);
            return b.add(new IrBinOp(NumericComparison.irTag(op), SimpleType.BOOL, lhs, rhs, source));
        }
        throw sema.fail(source, CompilerErrorCode.INVALID_OPERANDS,
                "invalid operands to binary expression: '%s' and '%s'", lhs.type(), rhs.type());
    }

    private IrInst analyzeBoolNot(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        SourceInfo source = instruction.source();
        IrInst operand = sema.coerce(block, SimpleType.BOOL,
                sema.resolveInst(block, instruction.data(InstData.UnNode.class).operand()));
        Value value = operand.value();
        if (value != null) {
            if (value.isUndef()) {
                return sema.constUndef(block, source, SimpleType.BOOL);
            }
            return sema.constBool(block, source, !Values.toBool(value));
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrUnOp(IrTag.NOT, SimpleType.BOOL, operand, source));
    }

    private IrInst analyzeBoolOp(Sema sema, Block block, UntypedInstruction instruction) throws SemanticException {
        SourceInfo source = instruction.source();
        boolean isOr = instruction.tag() == Tag.BOOL_OR;
        InstData.Bin bin = instruction.data(InstData.Bin.class);
        IrInst lhs = sema.coerce(block, SimpleType.BOOL, sema.resolveInst(block, bin.lhs()));
        IrInst rhs = sema.coerce(block, SimpleType.BOOL, sema.resolveInst(block, bin.rhs()));

        // A known operand equal to the short-circuit value decides the result alone.
        Value lhsValue = sema.resolveDefinedValue(lhs);
        Value rhsValue = sema.resolveDefinedValue(rhs);
        if (lhsValue != null) {
            boolean l = Values.toBool(lhsValue);
            if (rhsValue != null) {
                boolean r = Values.toBool(rhsValue);
                return sema.constBool(block, source, isOr ? l || r : l && r);
            }
            if (l == isOr) {
                return sema.constBool(block, source, isOr);
            }
        }
        if (rhsValue != null && Values.toBool(rhsValue) == isOr) {
            return sema.constBool(block, source, isOr);
        }
        Block b = sema.requireRuntimeBlock(block, source);
        return b.add(new IrBinOp(isOr ? IrTag.BOOL_OR : IrTag.BOOL_AND, SimpleType.BOOL, lhs, rhs, source));
    }

    private static String operatorName(Tag op) {
        return op.name().substring("CMP_".length()).toLowerCase();
    }
}
