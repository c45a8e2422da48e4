package com.relpilot.plugin.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of one progress event.
 *
 * @param kind        begin, report or end
 * @param title       session title, sent with {@code begin}
 * @param message     human-readable status line
 * @param percentage  0 to 100, not rounded
 * @param cancellable whether the operation honours cancellation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressValue(
        @JsonProperty("kind") ProgressKind kind,
        @JsonProperty("title") String title,
        @JsonProperty("message") String message,
        @JsonProperty("percentage") double percentage,
        @JsonProperty("cancellable") boolean cancellable
) {
    public ProgressValue {
        kind = kind != null ? kind : ProgressKind.REPORT;
        percentage = Double.isNaN(percentage) ? 0 : Math.max(0, Math.min(100, percentage));
    }

    public static ProgressValue begin(String title, String message) {
        return new ProgressValue(ProgressKind.BEGIN, title, message, 0, false);
    }

    public static ProgressValue report(String message, double percentage) {
        return new ProgressValue(ProgressKind.REPORT, null, message, percentage, false);
    }

    public static ProgressValue end(String message) {
        return new ProgressValue(ProgressKind.END, null, message, 100, false);
    }
}
