package org.kestrel.compiler.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SemaConfigTest {

    @Test
    @DisplayName("Unknown build mode should be reported as a bad value")
    void fromConfig_unknownBuildModeShouldFail() {
        ConfigException.BadValue e = assertThrows(ConfigException.BadValue.class, () -> SemaConfig.fromConfig(
                ConfigFactory.parseString("kestrel.sema { default-branch-quota = 10, build-mode = turbo }")));

        assertTrue(e.getMessage().contains("unknown build mode 'turbo'"));
    }

    @Test
    @DisplayName("Non-positive quota should be reported as a bad value")
    void fromConfig_nonPositiveQuotaShouldFail() {
        assertThrows(ConfigException.BadValue.class, () -> SemaConfig.fromConfig(
                ConfigFactory.parseString("kestrel.sema { default-branch-quota = 0, build-mode = debug }")));
    }

    @Test
    @DisplayName("Missing settings should be reported")
    void fromConfig_missingSettingsShouldFail() {
        assertThrows(ConfigException.Missing.class, () -> SemaConfig.fromConfig(ConfigFactory.empty()));
    }

    @Test
    @DisplayName("Stack size should accept a byte size and default when absent")
    void fromConfig_stackSizeShouldParseByteSize() {
        SemaConfig sized = SemaConfig.fromConfig(ConfigFactory.parseString(
                "kestrel.sema { default-branch-quota = 10, build-mode = debug, stack-size = 64m }"));
        SemaConfig unsized = SemaConfig.fromConfig(ConfigFactory.parseString(
                "kestrel.sema { default-branch-quota = 10, build-mode = debug }"));

        assertEquals(64L * 1024 * 1024, sized.stackSize());
        assertEquals(SemaConfig.DEFAULT_STACK_SIZE, unsized.stackSize());
    }

    @Test
    @DisplayName("Zero stack size should be reported as a bad value")
    void fromConfig_zeroStackSizeShouldFail() {
        assertThrows(ConfigException.BadValue.class, () -> SemaConfig.fromConfig(ConfigFactory.parseString(
                "kestrel.sema { default-branch-quota = 10, build-mode = debug, stack-size = 0 }")));
    }

    @Test
    void constructor_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new SemaConfig(-1, BuildMode.DEBUG));
        assertThrows(IllegalArgumentException.class, () -> new SemaConfig(1, null));
        assertThrows(IllegalArgumentException.class, () -> new SemaConfig(1, BuildMode.DEBUG, 0));
    }

    @Test
    void buildMode_shouldParseConfigSpelling() {
        assertEquals(BuildMode.RELEASE_FAST, BuildMode.fromConfigName(" release-fast "));
        assertFalse(BuildMode.RELEASE_FAST.isSafe());
        assertTrue(BuildMode.DEBUG.isSafe());
    }

    @Test
    void withers_shouldCopy() {
        SemaConfig config = SemaConfig.DEFAULTS.withDefaultBranchQuota(7).withBuildMode(BuildMode.RELEASE_SMALL);

        assertEquals(new SemaConfig(7, BuildMode.RELEASE_SMALL), config);
        assertEquals(1000, SemaConfig.DEFAULTS.defaultBranchQuota());
    }
}
