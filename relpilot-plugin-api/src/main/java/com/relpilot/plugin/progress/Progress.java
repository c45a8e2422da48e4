package com.relpilot.plugin.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Params of a {@code notifications/progress} notification.
 *
 * @param token      session token
 * @param value      event payload
 * @param totalSteps total number of steps declared at start
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Progress(
        @JsonProperty("token") ProgressToken token,
        @JsonProperty("value") ProgressValue value,
        @JsonProperty("totalSteps") int totalSteps
) {
    public Progress {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(value, "value");
    }
}
