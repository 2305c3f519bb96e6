package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.DiagnosticsSink;

/**
 * Counts backward branches taken during compile-time evaluation.
 * <p>
 * One instance is created per declaration or function analysis and shared by every call inlined into it,
 * so the count covers the whole inline chain.
 */
public final class BranchQuota {

    private int quota;
    private int count;

    public BranchQuota(int quota) {
        this.quota = quota;
    }

    /**
     * Records one backward branch.
     *
     * @throws SemanticException once the count exceeds the quota.
     */
    public void emitBackwardBranch(DiagnosticsSink sink, SourceInfo source) throws SemanticException {
        count++;
        if (count > quota) {
            throw sink.fail(source, CompilerErrorCode.BRANCH_QUOTA_EXCEEDED,
                    "evaluation exceeded %d backwards branches", quota);
        }
    }

    /**
     * Raises the quota; a smaller value leaves it unchanged.
     */
    public void raiseTo(int newQuota) {
        quota = Math.max(quota, newQuota);
    }

    public int quota() {
        return quota;
    }

    public int count() {
        return count;
    }
}
