package com.relpilot.plugin.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Typed access to a plugin's free-form configuration map (as decoded from JSON by Jackson:
 * strings, booleans, {@link Number}s, lists and maps). String fields can fall back to a chain of
 * environment variables.
 * <p>
 * Getters never throw: a missing field or a value of the wrong type yields the zero value or the
 * supplied default.
 */
public final class ConfigParser {

    private final Map<String, Object> raw;
    private final Function<String, String> env;

    public ConfigParser(Map<String, Object> config) {
        this(config, System::getenv);
    }

    /**
     * @param config configuration map, may be null
     * @param env    environment lookup; tests pass a map's {@code get}
     */
    public ConfigParser(Map<String, Object> config, Function<String, String> env) {
        this.raw = config != null ? config : Map.of();
        this.env = env != null ? env : k -> null;
    }

    /**
     * Non-empty string value of {@code field}, else the first non-empty environment variable among
     * {@code envVars}, else "".
     */
    public String getString(String field, String... envVars) {
        Object v = raw.get(field);
        if (v instanceof String s && !s.isEmpty()) {
            return s;
        }
        for (String envVar : envVars) {
            String val = env.apply(envVar);
            if (val != null && !val.isEmpty()) {
                return val;
            }
        }
        return "";
    }

    public boolean getBool(String field) {
        return getBool(field, false);
    }

    public boolean getBool(String field, boolean defaultValue) {
        Object v = raw.get(field);
        return v instanceof Boolean b ? b : defaultValue;
    }

    public int getInt(String field) {
        return getInt(field, 0);
    }

    /** Any JSON number is accepted; fractional values are truncated. */
    public int getInt(String field, int defaultValue) {
        Object v = raw.get(field);
        return v instanceof Number n ? n.intValue() : defaultValue;
    }

    public double getFloat(String field) {
        return getFloat(field, 0.0);
    }

    public double getFloat(String field, double defaultValue) {
        Object v = raw.get(field);
        return v instanceof Number n ? n.doubleValue() : defaultValue;
    }

    /**
     * String elements of a list field, in order; non-string elements are skipped.
     *
     * @return the list, or null when the field is missing or not a list
     */
    public List<String> getStringList(String field) {
        Object v = raw.get(field);
        if (!(v instanceof List<?> list)) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof String s) {
                result.add(s);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * String entries of an object field; non-string values are skipped.
     *
     * @return the map, or null when the field is missing or not an object
     */
    public Map<String, String> getStringMap(String field) {
        Object v = raw.get(field);
        if (!(v instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() instanceof String key && e.getValue() instanceof String value) {
                result.put(key, value);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /** True if the key is present, even with a null value. */
    public boolean has(String field) {
        return raw.containsKey(field);
    }

    public Map<String, Object> raw() {
        return raw;
    }
}
