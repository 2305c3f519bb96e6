package org.kestrel.compiler.diagnostics;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class DiagnosticsEngineTest {

    private static final SourceInfo SOURCE = new SourceInfo("main.kes", 3, 7);

    @Test
    void testFailRecordsErrorAndReturnsException() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        SemanticException e = engine.fail(SOURCE, CompilerErrorCode.VALUE_DOES_NOT_FIT,
                "type %s cannot represent integer value %s", "u8", 300);

        assertThat(e).hasMessage("type u8 cannot represent integer value 300");
        assertThat(e.getSourceInfo()).isEqualTo(SOURCE);
        assertThat(engine.hasErrors()).isTrue();
        Diagnostic diagnostic = engine.getDiagnostics().get(0);
        assertThat(diagnostic.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(diagnostic.code()).isEqualTo(CompilerErrorCode.VALUE_DOES_NOT_FIT);
    }

    @Test
    void testMessageWithoutArgumentsIsNotFormatted() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        SemanticException e = engine.fail(SOURCE, CompilerErrorCode.USER_COMPILE_ERROR, "100% broken");

        assertThat(e).hasMessage("100% broken");
    }

    @Test
    void testWarningsAreNotErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("unused", SOURCE);

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.summary()).isEqualTo("[WARNING] main.kes:3: unused");
    }

    @Test
    void testCompileLogIsCollectedInOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        SourceInfo second = new SourceInfo("main.kes", 9, 1);
        engine.compileLog(SOURCE, "@as(comptime_int, 1)");
        engine.compileLog(second, "@as(u8, 2)");

        assertThat(engine.getCompileLogText()).isEqualTo("@as(comptime_int, 1)\n@as(u8, 2)\n");
        assertThat(engine.getCompileLogSources()).containsExactly(SOURCE, second);
        assertThat(engine.hasErrors()).isFalse();
    }
}
