package org.kestrel.compiler.frontend.semantics;

import org.kestrel.compiler.frontend.semantics.analysis.BlockAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.CallAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.DebugAnalysisHandler;
import org.kestrel.compiler.frontend.semantics.analysis.SwitchAnalysisHandler;
import org.kestrel.compiler.frontend.untyped.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@org.junit.jupiter.api.Tag("unit")
@ExtendWith(MockitoExtension.class)
public class HandlerRegistryTest {

    @Mock
    private IInstructionHandler custom;

    @Test
    void testDefaultRegistryCoversEveryOpcode() {
        HandlerRegistry registry = HandlerRegistry.initializeWithDefaults();

        assertThat(registry.missingTags()).isEmpty();
        assertThat(registry.get(Tag.LOOP)).isInstanceOf(BlockAnalysisHandler.class);
        assertThat(registry.get(Tag.SWITCHBR_REF)).isInstanceOf(SwitchAnalysisHandler.class);
        assertThat(registry.get(Tag.RET)).isInstanceOf(CallAnalysisHandler.class);
        assertThat(registry.get(Tag.SET_EVAL_BRANCH_QUOTA)).isInstanceOf(DebugAnalysisHandler.class);
    }

    @Test
    void testMissingHandlerIsAnError() {
        HandlerRegistry registry = HandlerRegistry.initialize();

        assertThat(registry.missingTags()).isEqualTo(EnumSet.allOf(Tag.class));
        assertThatThrownBy(() -> registry.get(Tag.ADD))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("no handler registered for opcode ADD");
    }

    @Test
    void testRegisterReplacesHandler() {
        HandlerRegistry registry = HandlerRegistry.initializeWithDefaults();
        registry.register(Tag.ADD, custom);

        assertThat(registry.get(Tag.ADD)).isSameAs(custom);
        assertThat(registry.get(Tag.SUB)).isNotSameAs(custom);
    }
}
