package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.frontend.semantics.Block;
import org.kestrel.compiler.frontend.semantics.IInstructionHandler;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.frontend.untyped.InstData;
import org.kestrel.compiler.frontend.untyped.UntypedInstruction;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.module.FileScope;
import org.kestrel.compiler.module.ImportException;

/**
 * Handles the semantic analysis of references to declarations and files.
 */
public class DeclAnalysisHandler implements IInstructionHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrInst analyze(Sema sema, Block block, int inst) throws SemanticException {
        UntypedInstruction instruction = block.code().instruction(inst);
        SourceInfo source = instruction.source();
        String name = block.code().string(instruction.data(InstData.Str.class));
        switch (instruction.tag()) {
            case DECL_REF:
                return sema.analyzeDeclRef(block, source, lookup(sema, block, source, name));
            case DECL_VAL: {
                IrInst ref = sema.analyzeDeclRef(block, source, lookup(sema, block, source, name));
                return sema.analyzeDeref(block, source, ref);
            }
            case IMPORT:
                return analyzeImport(sema, block, source, name);
            default:
                throw new IllegalStateException("unexpected opcode " + instruction.tag());
        }
    }

    private Decl lookup(Sema sema, Block block, SourceInfo source, String name) throws SemanticException {
        return block.fileScope().lookupDecl(name)
                .orElseThrow(() -> sema.fail(source, "use of undeclared identifier '%s'", name));
    }

    private IrInst analyzeImport(Sema sema, Block block, SourceInfo source, String path) throws SemanticException {
        FileScope file;
        try {
            file = sema.context().imports().resolveImport(block.fileScope(), path);
        } catch (ImportException e) {
            switch (e.getKind()) {
                case OUTSIDE_PACKAGE:
                    throw sema.fail(source, CompilerErrorCode.IMPORT_FAILED,
                            "import of file outside package path: '%s'", path);
                case NOT_FOUND:
                default:
                    throw sema.fail(source, CompilerErrorCode.IMPORT_FAILED, "unable to find '%s'", path);
            }
        }
        return sema.constType(block, source, file.rootType());
    }
}
