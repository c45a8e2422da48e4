package com.relpilot.plugin.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Level of a {@code notifications/message} log line. */
public enum LogLevel {
    DEBUG("debug"),
    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String value;

    LogLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** Unknown or blank values read as {@link #INFO}. "warn" is accepted for {@link #WARNING}. */
    @JsonCreator
    public static LogLevel fromValue(String value) {
        if (value == null || value.isBlank()) return INFO;
        String v = value.trim().toLowerCase();
        if ("warn".equals(v)) return WARNING;
        for (LogLevel level : values()) {
            if (level.value.equals(v)) return level;
        }
        return INFO;
    }
}
