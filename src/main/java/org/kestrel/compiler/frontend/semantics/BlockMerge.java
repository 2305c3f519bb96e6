package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.ir.IrBlock;
import org.kestrel.compiler.ir.IrBody;
import org.kestrel.compiler.ir.IrBr;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the breaks targeting one block and closes the block once its body is analyzed.
 */
public final class BlockMerge {

    private final IrBlock blockInst;
    private final List<IrInst> results = new ArrayList<>();
    private final List<IrBr> brs = new ArrayList<>();

    public BlockMerge(IrBlock blockInst) {
        this.blockInst = blockInst;
    }

    public IrBlock blockInst() {
        return blockInst;
    }

    public void addBreak(IrBr br) {
        results.add(br.operand());
        brs.add(br);
    }

    public List<IrInst> results() {
        return Collections.unmodifiableList(results);
    }

    /**
     * Closes the block analyzed in {@code child} and attaches it to {@code parent}.
     * <ul>
     *     <li>Without breaks the child's instructions are spliced into the parent.</li>
     *     <li>With one break that ends the body, the instructions before it are spliced and the break operand
     *     is the result.</li>
     *     <li>Otherwise the block instruction is emitted with the peer type of all break operands, and every
     *     break whose operand has a different type is patched with a coercion.</li>
     * </ul>
     *
     * @return The result of the block expression.
     */
    public IrInst finish(Sema sema, Block parent, Block child) throws SemanticException {
        List<IrInst> insts = child.instructions();
        IrInst last = child.lastInstruction();
        if (last == null || !last.isNoReturn()) {
            throw new IllegalStateException("block body does not end in a noreturn instruction at " + blockInst.source());
        }

        if (results.isEmpty()) {
            parent.splice(insts);
            return last;
        }
        if (results.size() == 1 && last instanceof IrBr br && br.block() == blockInst) {
            parent.splice(insts.subList(0, insts.size() - 1));
            return results.get(0);
        }

        Type resultType = sema.resolvePeerTypes(child, results);
        blockInst.setType(resultType);
        blockInst.setBody(new IrBody(insts));
        parent.add(blockInst);

        for (IrBr br : brs) {
            IrInst operand = br.operand();
            if (operand.type().equals(resultType)) {
                continue;
            }
            Block coercionBlock = child.makeSubBlock();
            IrInst coerced = sema.coerce(coercionBlock, resultType, operand);
            if (coercionBlock.instructions().isEmpty()) {
                br.setOperand(coerced);
            } else {
                br.attachCoercion(new IrBody(coercionBlock.instructions()), coerced);
            }
        }
        return blockInst;
    }
}
