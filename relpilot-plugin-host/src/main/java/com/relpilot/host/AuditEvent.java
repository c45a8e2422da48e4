package com.relpilot.host;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * One audit record: a plugin was loaded, executed, timed out or unloaded.
 *
 * @param timestamp      when the event happened (UTC)
 * @param pluginName     configured plugin name
 * @param hook           hook value for execute events, else null
 * @param type           event type
 * @param success        outcome
 * @param durationMillis execution time for execute events, else 0
 * @param error          failure message, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("plugin_name") String pluginName,
        @JsonProperty("hook") String hook,
        @JsonProperty("event_type") Type type,
        @JsonProperty("success") boolean success,
        @JsonProperty("duration_ms") long durationMillis,
        @JsonProperty("error") String error
) {

    public enum Type {
        LOAD,
        UNLOAD,
        EXECUTE,
        TIMEOUT;

        @JsonValue
        public String toValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Type fromValue(String value) {
            if (value == null || value.isBlank()) return EXECUTE;
            try {
                return valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return EXECUTE;
            }
        }
    }

    static AuditEvent now(String pluginName, String hook, Type type, boolean success, long durationMillis,
                          String error) {
        String err = (error != null && !error.isEmpty()) ? error : null;
        return new AuditEvent(Instant.now().toString(), pluginName, hook, type, success, durationMillis, err);
    }
}
