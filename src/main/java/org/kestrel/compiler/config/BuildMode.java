package org.kestrel.compiler.config;

import java.util.Locale;

/**
 * Optimization mode of the build being analyzed. Decides whether runtime safety checks are emitted.
 */
public enum BuildMode {
    DEBUG(true),
    RELEASE_SAFE(true),
    RELEASE_FAST(false),
    RELEASE_SMALL(false);

    private final boolean safe;

    BuildMode(boolean safe) {
        this.safe = safe;
    }

    /**
     * @return {@code true} if safety checks are wanted in this mode.
     */
    public boolean isSafe() {
        return safe;
    }

    /**
     * Parses the configuration spelling of a mode, e.g. {@code "release-safe"}.
     *
     * @param name The configured name.
     * @return The matching mode.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static BuildMode fromConfigName(String name) {
        return BuildMode.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
