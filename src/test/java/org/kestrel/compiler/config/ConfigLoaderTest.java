package org.kestrel.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties over the configuration file over reference.conf.
 */
@Tag("unit")
class ConfigLoaderTest {

    private static final String TEST_CONFIG = "org/kestrel/compiler/config/test-config.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("kestrel.sema.default-branch-quota");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should load configuration file over reference defaults")
    void load_shouldPreferFileOverDefaults() {
        Config config = ConfigLoader.load(TEST_CONFIG);

        assertEquals(250, config.getInt("kestrel.sema.default-branch-quota"));
        assertEquals("release-safe", config.getString("kestrel.sema.build-mode"));
        assertTrue(config.hasPath("logging.default-level"), "reference.conf should supply the logging block");
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("kestrel.sema.default-branch-quota", "5000");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(TEST_CONFIG);

        assertEquals(5000, config.getInt("kestrel.sema.default-branch-quota"));
        assertEquals("release-safe", config.getString("kestrel.sema.build-mode"));
    }

    @Test
    @DisplayName("Missing configuration file should fall back to reference.conf")
    void load_missingFileShouldUseDefaults() {
        SemaConfig sema = SemaConfig.fromConfig(ConfigLoader.load("org/kestrel/compiler/config/does-not-exist.conf"));

        assertEquals(SemaConfig.DEFAULTS, sema);
    }

    @Test
    @DisplayName("Analysis settings should be read from the merged configuration")
    void fromConfig_shouldReadAnalysisSettings() {
        SemaConfig sema = SemaConfig.fromConfig(ConfigLoader.load(TEST_CONFIG));

        assertEquals(250, sema.defaultBranchQuota());
        assertEquals(BuildMode.RELEASE_SAFE, sema.buildMode());
        assertTrue(sema.wantSafety());
    }
}
