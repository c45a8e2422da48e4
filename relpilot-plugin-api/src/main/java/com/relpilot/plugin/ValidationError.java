package com.relpilot.plugin;

/**
 * One configuration problem reported by {@link Plugin#validate}.
 *
 * @param field   config field that failed (e.g. "token", "assets[2]"); empty when not field-specific
 * @param message human-readable message
 * @param code    optional machine code (required, type, enum, format)
 */
public record ValidationError(
        String field,
        String message,
        String code
) {
    public ValidationError {
        field = field != null ? field : "";
        message = message != null ? message : "";
        code = code != null ? code : "";
    }

    @Override
    public String toString() {
        return field.isEmpty() ? message : field + ": " + message;
    }
}
