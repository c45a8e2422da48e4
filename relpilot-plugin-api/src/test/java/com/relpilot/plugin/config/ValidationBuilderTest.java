package com.relpilot.plugin.config;

import com.relpilot.plugin.ValidateResponse;
import com.relpilot.plugin.ValidationError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationBuilderTest {

    private static final Map<String, String> ENV = Map.of("SLACK_WEBHOOK", "https://hooks.example.com/x");

    @Test
    void build_validWhenNoErrors() {
        ValidateResponse resp = new ValidationBuilder(ENV::get)
                .requireString(Map.of("owner", "acme"), "owner")
                .build();
        assertTrue(resp.valid());
        assertTrue(resp.errors().isEmpty());
    }

    @Test
    void build_keepsErrorsInOrder() {
        Map<String, Object> config = Map.of("mode", "yolo", "pattern", "([a-z", "labels", List.of("ok", 3));
        ValidationBuilder vb = new ValidationBuilder(ENV::get)
                .requireString(config, "owner")
                .validateEnum(config, "mode", List.of("draft", "publish"))
                .validateRegex(config, "pattern")
                .validateStringList(config, "labels");
        assertTrue(vb.hasErrors());

        List<ValidationError> errors = vb.build().errors();
        assertEquals(4, errors.size());
        assertEquals(new ValidationError("owner", "owner is required", "required"), errors.get(0));
        assertEquals("mode must be one of: draft, publish", errors.get(1).message());
        assertEquals("enum", errors.get(1).code());
        assertEquals("pattern", errors.get(2).field());
        assertTrue(errors.get(2).message().startsWith("invalid regex pattern: "));
        assertEquals(new ValidationError("labels[1]", "labels[1] must be string", "type"), errors.get(3));
        assertFalse(vb.build().valid());
    }

    @Test
    void requireStringWithEnv_acceptsEnvFallbackAndHintsVariables() {
        ValidationBuilder ok = new ValidationBuilder(ENV::get)
                .requireStringWithEnv(Map.of(), "webhook", "SLACK_WEBHOOK");
        assertFalse(ok.hasErrors());

        ValidationBuilder missing = new ValidationBuilder(ENV::get)
                .requireStringWithEnv(Map.of(), "token", "GITHUB_TOKEN", "GH_TOKEN");
        assertEquals("token is required (or set GITHUB_TOKEN or GH_TOKEN)", missing.errors().get(0).message());

        ValidationBuilder noHint = new ValidationBuilder(ENV::get).requireStringWithEnv(Map.of(), "token");
        assertEquals("token is required", noHint.errors().get(0).message());
    }

    @Test
    void validateChecks_ignoreMissingFields() {
        ValidationBuilder vb = new ValidationBuilder(ENV::get)
                .validateUrl(Map.of(), "url")
                .validateRegex(Map.of(), "pattern")
                .validateEnum(Map.of(), "mode", List.of("a"))
                .validateStringList(Map.of("labels", "notalist"), "labels");
        assertFalse(vb.hasErrors());
    }

    @Test
    void validateUrl_rejectsMalformed() {
        ValidationBuilder vb = new ValidationBuilder(ENV::get)
                .validateUrl(Map.of("url", "https://exa mple.com"), "url");
        assertEquals(new ValidationError("url", "invalid URL format", "format"), vb.errors().get(0));
    }
}
