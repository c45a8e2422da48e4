package com.relpilot.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One configured plugin: name, optional binary path, the hooks it is wired to and the
 * plugin-specific config map handed to validate/execute.
 * <p>
 * Hooks are kept as wire strings ({@code "pre-publish"}); an empty list means every hook the
 * plugin advertises. A null timeout means the host default applies.
 */
public final class PluginConfig {

    private final String name;
    private final String path;
    private final boolean enabled;
    private final List<String> hooks;
    private final Map<String, Object> config;
    private final Duration timeout;
    private final boolean continueOnError;

    private PluginConfig(Builder b) {
        this.name = b.name;
        this.path = b.path;
        this.enabled = b.enabled;
        this.hooks = Collections.unmodifiableList(new ArrayList<>(b.hooks));
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(b.config));
        this.timeout = b.timeout;
        this.continueOnError = b.continueOnError;
    }

    public String getName() {
        return name;
    }

    /** Explicit binary path, or null to search the allowed plugin directories by name. */
    public String getPath() {
        return path;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> getHooks() {
        return hooks;
    }

    /** True when {@code hook} is listed, or when no hooks are listed at all. */
    public boolean hasHook(String hook) {
        if (hooks.isEmpty()) return true;
        for (String h : hooks) {
            if (h.equals(hook)) return true;
        }
        return false;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /** Effective timeout: the configured one, else {@code defaultTimeout}. */
    public Duration timeoutOr(Duration defaultTimeout) {
        return timeout != null ? timeout : defaultTimeout;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    @Override
    public String toString() {
        return "PluginConfig{name=" + name + ", enabled=" + enabled + ", hooks=" + hooks + "}";
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String path;
        private boolean enabled = true;
        private List<String> hooks = List.of();
        private Map<String, Object> config = Map.of();
        private Duration timeout;
        private boolean continueOnError;

        private Builder(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("plugin name cannot be empty");
            }
            this.name = name.trim();
        }

        public Builder path(String path) {
            this.path = (path != null && !path.isBlank()) ? path.trim() : null;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder hooks(List<String> hooks) {
            List<String> copy = new ArrayList<>();
            if (hooks != null) {
                for (String h : hooks) {
                    if (h != null && !h.isBlank()) copy.add(h.trim());
                }
            }
            this.hooks = copy;
            return this;
        }

        public Builder hooks(String... hooks) {
            List<String> list = hooks != null ? Arrays.asList(hooks) : new ArrayList<>();
            return hooks(list);
        }

        public Builder config(Map<String, Object> config) {
            this.config = config != null ? new LinkedHashMap<>(config) : Map.of();
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public PluginConfig build() {
            return new PluginConfig(this);
        }
    }
}
