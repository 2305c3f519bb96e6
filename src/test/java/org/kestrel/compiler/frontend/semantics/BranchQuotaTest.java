package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.kestrel.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class BranchQuotaTest {

    private static final SourceInfo SOURCE = new SourceInfo("main.kes", 1, 1);

    @Test
    void testQuotaAllowsExactlyItsCount() throws SemanticException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        BranchQuota quota = new BranchQuota(3);
        for (int i = 0; i < 3; i++) {
            quota.emitBackwardBranch(diagnostics, SOURCE);
        }

        assertThatThrownBy(() -> quota.emitBackwardBranch(diagnostics, SOURCE))
                .isInstanceOf(SemanticException.class)
                .hasMessage("evaluation exceeded 3 backwards branches");
        assertThat(diagnostics.getDiagnostics().get(0).code()).isEqualTo(CompilerErrorCode.BRANCH_QUOTA_EXCEEDED);
    }

    @Test
    void testQuotaOnlyRises() {
        BranchQuota quota = new BranchQuota(100);

        quota.raiseTo(10);
        assertThat(quota.quota()).isEqualTo(100);
        quota.raiseTo(500);
        assertThat(quota.quota()).isEqualTo(500);
        assertThat(quota.count()).isZero();
    }
}
