package com.relpilot.plugin.config;

import com.relpilot.plugin.ValidateResponse;
import com.relpilot.plugin.ValidationError;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Fluent accumulator of {@link ValidationError}s. The {@code validate*} checks only look at fields
 * that are present and non-empty; pair them with {@code require*} for mandatory fields.
 *
 * <pre>{@code
 * return new ValidationBuilder()
 *         .requireStringWithEnv(config, "token", "GITHUB_TOKEN")
 *         .validateEnum(config, "mode", List.of("draft", "publish"))
 *         .build();
 * }</pre>
 */
public final class ValidationBuilder {

    public static final String CODE_REQUIRED = "required";
    public static final String CODE_TYPE = "type";
    public static final String CODE_ENUM = "enum";
    public static final String CODE_FORMAT = "format";

    private final List<ValidationError> errors = new ArrayList<>();
    private final Function<String, String> env;

    public ValidationBuilder() {
        this(System::getenv);
    }

    public ValidationBuilder(Function<String, String> env) {
        this.env = env != null ? env : k -> null;
    }

    public ValidationBuilder addError(String field, String message, String code) {
        errors.add(new ValidationError(field, message, code));
        return this;
    }

    public ValidationBuilder addRequired(String field) {
        return addError(field, field + " is required", CODE_REQUIRED);
    }

    public ValidationBuilder addTypeError(String field, String expectedType) {
        return addError(field, field + " must be " + expectedType, CODE_TYPE);
    }

    public ValidationBuilder addEnumError(String field, List<String> validValues) {
        return addError(field, field + " must be one of: " + String.join(", ", validValues), CODE_ENUM);
    }

    public ValidationBuilder addFormatError(String field, String message) {
        return addError(field, message, CODE_FORMAT);
    }

    /** Requires a non-empty string value. */
    public ValidationBuilder requireString(Map<String, Object> config, String field) {
        if (stringValue(config, field).isEmpty()) {
            addRequired(field);
        }
        return this;
    }

    /** Requires a non-empty string value or at least one non-empty environment variable. */
    public ValidationBuilder requireStringWithEnv(Map<String, Object> config, String field, String... envVars) {
        if (!stringValue(config, field).isEmpty()) {
            return this;
        }
        for (String envVar : envVars) {
            String val = env.apply(envVar);
            if (val != null && !val.isEmpty()) {
                return this;
            }
        }
        String hint = envVars.length > 0 ? " (or set " + String.join(" or ", envVars) + ")" : "";
        return addError(field, field + " is required" + hint, CODE_REQUIRED);
    }

    /** Reports each non-string element of a list field as {@code field[i]}. */
    public ValidationBuilder validateStringList(Map<String, Object> config, String field) {
        Object v = config != null ? config.get(field) : null;
        if (!(v instanceof List<?> list)) {
            return this;
        }
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof String)) {
                addTypeError(field + "[" + i + "]", "string");
            }
        }
        return this;
    }

    public ValidationBuilder validateRegex(Map<String, Object> config, String field) {
        String pattern = stringValue(config, field);
        if (pattern.isEmpty()) {
            return this;
        }
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            addFormatError(field, "invalid regex pattern: " + e.getDescription());
        }
        return this;
    }

    public ValidationBuilder validateUrl(Map<String, Object> config, String field) {
        String url = stringValue(config, field);
        if (url.isEmpty()) {
            return this;
        }
        try {
            new URI(url);
        } catch (URISyntaxException e) {
            addFormatError(field, "invalid URL format");
        }
        return this;
    }

    public ValidationBuilder validateEnum(Map<String, Object> config, String field, List<String> validValues) {
        String val = stringValue(config, field);
        if (val.isEmpty() || validValues.contains(val)) {
            return this;
        }
        return addEnumError(field, validValues);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<ValidationError> errors() {
        return Collections.unmodifiableList(errors);
    }

    /** Valid iff no error was recorded. */
    public ValidateResponse build() {
        return new ValidateResponse(errors.isEmpty(), errors);
    }

    private static String stringValue(Map<String, Object> config, String field) {
        Object v = config != null ? config.get(field) : null;
        return v instanceof String ? (String) v : "";
    }
}
