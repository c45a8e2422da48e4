package com.relpilot.plugin.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of a progress session: {@link #BEGIN} once on start, {@link #REPORT} for each update,
 * {@link #END} once on completion.
 */
public enum ProgressKind {
    BEGIN("begin"),
    REPORT("report"),
    END("end");

    private final String value;

    ProgressKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static ProgressKind fromValue(String value) {
        if (value == null || value.isBlank()) return REPORT;
        String v = value.trim();
        for (ProgressKind kind : values()) {
            if (kind.value.equalsIgnoreCase(v)) return kind;
        }
        return REPORT;
    }
}
