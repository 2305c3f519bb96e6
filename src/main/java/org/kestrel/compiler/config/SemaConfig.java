package org.kestrel.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Immutable settings of the semantic analysis stage.
 *
 * @param defaultBranchQuota Backward branches allowed during compile-time evaluation before analysis fails.
 * @param buildMode          The build mode; decides whether safety checks are inserted.
 * @param stackSize          Stack size in bytes of the thread that runs analysis.
 */
public record SemaConfig(int defaultBranchQuota, BuildMode buildMode, long stackSize) {

    /** Configuration path of the analysis settings. */
    public static final String CONFIG_PATH = "kestrel.sema";

    /** Analysis stack size used when none is configured. */
    public static final long DEFAULT_STACK_SIZE = 256L * 1024 * 1024;

    /** Settings matching the shipped {@code reference.conf}. */
    public static final SemaConfig DEFAULTS = new SemaConfig(1000, BuildMode.DEBUG);

    public SemaConfig {
        if (defaultBranchQuota <= 0) {
            throw new IllegalArgumentException("defaultBranchQuota must be positive: " + defaultBranchQuota);
        }
        if (buildMode == null) {
            throw new IllegalArgumentException("buildMode must not be null");
        }
        if (stackSize <= 0) {
            throw new IllegalArgumentException("stackSize must be positive: " + stackSize);
        }
    }

    public SemaConfig(int defaultBranchQuota, BuildMode buildMode) {
        this(defaultBranchQuota, buildMode, DEFAULT_STACK_SIZE);
    }

    /**
     * Reads the settings below {@value #CONFIG_PATH}. {@code stack-size} is optional and accepts
     * HOCON size units such as {@code 64m}.
     *
     * @param config The resolved application configuration.
     * @return The analysis settings.
     * @throws ConfigException if a value is missing or invalid.
     */
    public static SemaConfig fromConfig(Config config) {
        Config sema = config.getConfig(CONFIG_PATH);
        int quota = sema.getInt("default-branch-quota");
        if (quota <= 0) {
            throw new ConfigException.BadValue(CONFIG_PATH + ".default-branch-quota", "must be positive, was " + quota);
        }
        long stackSize = DEFAULT_STACK_SIZE;
        if (sema.hasPath("stack-size")) {
            stackSize = sema.getBytes("stack-size");
            if (stackSize <= 0) {
                throw new ConfigException.BadValue(CONFIG_PATH + ".stack-size", "must be positive, was " + stackSize);
            }
        }
        String mode = sema.getString("build-mode");
        try {
            return new SemaConfig(quota, BuildMode.fromConfigName(mode), stackSize);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(CONFIG_PATH + ".build-mode", "unknown build mode '" + mode + "'", e);
        }
    }

    /**
     * @return {@code true} if runtime safety checks should be emitted.
     */
    public boolean wantSafety() {
        return buildMode.isSafe();
    }

    /**
     * @param quota The new default quota.
     * @return A copy with a different default branch quota.
     */
    public SemaConfig withDefaultBranchQuota(int quota) {
        return new SemaConfig(quota, buildMode, stackSize);
    }

    /**
     * @param mode The new build mode.
     * @return A copy with a different build mode.
     */
    public SemaConfig withBuildMode(BuildMode mode) {
        return new SemaConfig(defaultBranchQuota, mode, stackSize);
    }

    /**
     * @param bytes The new analysis stack size.
     * @return A copy with a different analysis stack size.
     */
    public SemaConfig withStackSize(long bytes) {
        return new SemaConfig(defaultBranchQuota, buildMode, bytes);
    }
}
