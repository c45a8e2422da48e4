package com.relpilot.plugin.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Params of a {@code notifications/message} notification. Fire-and-forget; nothing is stored.
 *
 * @param level   severity
 * @param message log text
 * @param logger  name of the emitting logger (usually the plugin name)
 * @param data    optional structured data, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogNotification(
        @JsonProperty("level") LogLevel level,
        @JsonProperty("message") String message,
        @JsonProperty("logger") String logger,
        @JsonProperty("data") Map<String, Object> data
) {
    public LogNotification {
        level = level != null ? level : LogLevel.INFO;
        message = message != null ? message : "";
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : null;
    }
}
