package com.relpilot.plugin;

import java.util.List;

/**
 * Result of configuration validation. Use {@link com.relpilot.plugin.config.ValidationBuilder}
 * to accumulate errors and build one.
 */
public record ValidateResponse(
        boolean valid,
        List<ValidationError> errors
) {
    public ValidateResponse {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ValidateResponse ok() {
        return new ValidateResponse(true, List.of());
    }

    public static ValidateResponse invalid(String field, String message) {
        return new ValidateResponse(false, List.of(new ValidationError(field, message, "")));
    }
}
