package com.relpilot.plugin.progress;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Opaque identifier correlating the start, updates and completion of one progress session.
 * Serialized as a bare JSON string.
 */
public final class ProgressToken {

    private final String value;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ProgressToken(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static ProgressToken of(String value) {
        return new ProgressToken(value);
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof ProgressToken other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
