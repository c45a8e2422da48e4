package com.relpilot.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Host-side plugin settings loaded from environment variables.
 * <p>
 * Plugin directories: RELPILOT_PLUGIN_DIRS (comma-separated). When unset, binaries are searched in
 * {@code ~/.relpilot/plugins}, {@code .relpilot/plugins}, {@code /usr/local/lib/relpilot/plugins}
 * and {@code /usr/lib/relpilot/plugins}.
 * <p>
 * Timeouts: RELPILOT_PLUGIN_START_TIMEOUT_SECONDS, RELPILOT_PLUGIN_TIMEOUT_SECONDS,
 * RELPILOT_HOOK_TIMEOUT_SECONDS, RELPILOT_GET_INFO_TIMEOUT_MILLIS.
 */
public final class HostConfig {

    private static final String ENV_PLUGIN_DIRS = "RELPILOT_PLUGIN_DIRS";
    private static final String ENV_START_TIMEOUT_SECONDS = "RELPILOT_PLUGIN_START_TIMEOUT_SECONDS";
    private static final String ENV_PLUGIN_TIMEOUT_SECONDS = "RELPILOT_PLUGIN_TIMEOUT_SECONDS";
    private static final String ENV_HOOK_TIMEOUT_SECONDS = "RELPILOT_HOOK_TIMEOUT_SECONDS";
    private static final String ENV_MAX_CONCURRENCY = "RELPILOT_PLUGIN_MAX_CONCURRENCY";
    private static final String ENV_GET_INFO_TIMEOUT_MILLIS = "RELPILOT_GET_INFO_TIMEOUT_MILLIS";
    private static final String ENV_DRY_RUN = "RELPILOT_DRY_RUN";
    private static final String ENV_HOME = "HOME";

    private static final int DEFAULT_START_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_PLUGIN_TIMEOUT_SECONDS = 30;
    /** Upper bound for all plugins of one hook together. */
    private static final int DEFAULT_HOOK_TIMEOUT_SECONDS = 120;
    private static final int DEFAULT_MAX_CONCURRENCY = 10;
    private static final int DEFAULT_GET_INFO_TIMEOUT_MILLIS = 5000;

    private final List<Path> pluginDirs;
    private final Duration startTimeout;
    private final Duration pluginTimeout;
    private final Duration hookTimeout;
    private final int maxConcurrency;
    private final Duration getInfoTimeout;
    private final boolean dryRun;

    private HostConfig(Builder b) {
        this.pluginDirs = Collections.unmodifiableList(new ArrayList<>(b.pluginDirs));
        this.startTimeout = b.startTimeout;
        this.pluginTimeout = b.pluginTimeout;
        this.hookTimeout = b.hookTimeout;
        this.maxConcurrency = b.maxConcurrency;
        this.getInfoTimeout = b.getInfoTimeout;
        this.dryRun = b.dryRun;
    }

    /** Directories a plugin binary must resolve into. Order is the search order. */
    public List<Path> getPluginDirs() {
        return pluginDirs;
    }

    /** How long to wait for a spawned plugin to print its handshake line. Default 60 s. */
    public Duration getStartTimeout() {
        return startTimeout;
    }

    /** Default per-plugin execution timeout, used when a plugin config sets none. Default 30 s. */
    public Duration getPluginTimeout() {
        return pluginTimeout;
    }

    public Duration getHookTimeout() {
        return hookTimeout;
    }

    /** Max plugins executing at the same time for one host. Default 10. */
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getGetInfoTimeout() {
        return getInfoTimeout;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Builder toBuilder() {
        return builder()
                .pluginDirs(pluginDirs)
                .startTimeout(startTimeout)
                .pluginTimeout(pluginTimeout)
                .hookTimeout(hookTimeout)
                .maxConcurrency(maxConcurrency)
                .getInfoTimeout(getInfoTimeout)
                .dryRun(dryRun);
    }

    public static HostConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reading from the given map (tests, embedded hosts). */
    public static HostConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> dirs = parseCommaSeparated(env.get(ENV_PLUGIN_DIRS));
        List<Path> pluginDirs = dirs.isEmpty()
                ? defaultPluginDirs(getEnv(env, ENV_HOME, "/tmp"))
                : dirs.stream().map(Paths::get).collect(Collectors.toList());

        return builder()
                .pluginDirs(pluginDirs)
                .startTimeout(Duration.ofSeconds(positive(parseInt(env.get(ENV_START_TIMEOUT_SECONDS), DEFAULT_START_TIMEOUT_SECONDS), DEFAULT_START_TIMEOUT_SECONDS)))
                .pluginTimeout(Duration.ofSeconds(positive(parseInt(env.get(ENV_PLUGIN_TIMEOUT_SECONDS), DEFAULT_PLUGIN_TIMEOUT_SECONDS), DEFAULT_PLUGIN_TIMEOUT_SECONDS)))
                .hookTimeout(Duration.ofSeconds(positive(parseInt(env.get(ENV_HOOK_TIMEOUT_SECONDS), DEFAULT_HOOK_TIMEOUT_SECONDS), DEFAULT_HOOK_TIMEOUT_SECONDS)))
                .maxConcurrency(positive(parseInt(env.get(ENV_MAX_CONCURRENCY), DEFAULT_MAX_CONCURRENCY), DEFAULT_MAX_CONCURRENCY))
                .getInfoTimeout(Duration.ofMillis(positive(parseInt(env.get(ENV_GET_INFO_TIMEOUT_MILLIS), DEFAULT_GET_INFO_TIMEOUT_MILLIS), DEFAULT_GET_INFO_TIMEOUT_MILLIS)))
                .dryRun(parseBoolean(env.get(ENV_DRY_RUN), false))
                .build();
    }

    static List<Path> defaultPluginDirs(String home) {
        return List.of(
                Paths.get(home, ".relpilot", "plugins"),
                Paths.get(".relpilot", "plugins"),
                Paths.get("/usr/local/lib/relpilot/plugins"),
                Paths.get("/usr/lib/relpilot/plugins"));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int positive(int value, int defaultValue) {
        return value > 0 ? value : defaultValue;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<Path> pluginDirs = defaultPluginDirs(System.getProperty("user.home", "/tmp"));
        private Duration startTimeout = Duration.ofSeconds(DEFAULT_START_TIMEOUT_SECONDS);
        private Duration pluginTimeout = Duration.ofSeconds(DEFAULT_PLUGIN_TIMEOUT_SECONDS);
        private Duration hookTimeout = Duration.ofSeconds(DEFAULT_HOOK_TIMEOUT_SECONDS);
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private Duration getInfoTimeout = Duration.ofMillis(DEFAULT_GET_INFO_TIMEOUT_MILLIS);
        private boolean dryRun;

        public Builder pluginDirs(List<Path> pluginDirs) {
            this.pluginDirs = new ArrayList<>(Objects.requireNonNull(pluginDirs, "pluginDirs"));
            return this;
        }

        public Builder pluginDir(Path pluginDir) {
            this.pluginDirs = new ArrayList<>(pluginDirs);
            this.pluginDirs.add(Objects.requireNonNull(pluginDir, "pluginDir"));
            return this;
        }

        public Builder startTimeout(Duration startTimeout) {
            this.startTimeout = requirePositive(startTimeout, "startTimeout");
            return this;
        }

        public Builder pluginTimeout(Duration pluginTimeout) {
            this.pluginTimeout = requirePositive(pluginTimeout, "pluginTimeout");
            return this;
        }

        public Builder hookTimeout(Duration hookTimeout) {
            this.hookTimeout = requirePositive(hookTimeout, "hookTimeout");
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder getInfoTimeout(Duration getInfoTimeout) {
            this.getInfoTimeout = requirePositive(getInfoTimeout, "getInfoTimeout");
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public HostConfig build() {
            return new HostConfig(this);
        }

        private static Duration requirePositive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + d);
            }
            return d;
        }
    }
}
