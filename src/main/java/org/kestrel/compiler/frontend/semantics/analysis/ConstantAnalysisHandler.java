package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.types.BytesValue;
import org.kestrel.compiler.types.EnumLiteralValue;
import org.kestrel.compiler.types.FloatValue;
import org.kestrel.compiler.types.IntValue;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.TypedValue;
import org.kestrel.compiler.types.Types;

/**
 * Handles the semantic analysis of literals.
 * String literals become anonymous declarations; the result is a pointer to one.
 */
public class ConstantAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        SourceInfo source = instruction.source();
        switch (instruction.tag()) {
            case INT:
                return sema.constInst(block, source, SimpleType.COMPTIME_INT,
                        new IntValue(instruction.data(InstData.Int.class).value()));
            case FLOAT:
                return sema.constInst(block, source, SimpleType.COMPTIME_FLOAT,
                        new FloatValue(instruction.data(InstData.Float.class).value()));
            case STR: {
                byte[] bytes = block.code().bytes(instruction.data(InstData.Str.class));
                TypedValue literal = new TypedValue(Types.stringLiteralType(bytes.length), new BytesValue(bytes));
                Decl decl = sema.context().declarations().createAnonymousDecl(block.owner(), literal);
                return sema.analyzeDeclRef(block, source, decl);
            }
            case ENUM_LITERAL: {
                String name = block.code().string(instruction.data(InstData.Str.class));
                return sema.constInst(block, source, SimpleType.ENUM_LITERAL, new EnumLiteralValue(name));
            }
            case VOID_VALUE:
                return sema.constVoid(block, source);
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }
}
