package com.relpilot.plugin.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlValidatorTest {

    private final UrlValidator slack = new UrlValidator("https")
            .withHosts("hooks.slack.com")
            .withPathPrefix("/services/");

    @Test
    void validate_acceptsMatchingUrl() {
        assertDoesNotThrow(() -> slack.validate("https://hooks.slack.com/services/T000/B000/XXX"));
        assertTrue(slack.isValid("https://hooks.slack.com/services/abc"));
    }

    @Test
    void validate_rejectsEachRule() {
        assertEquals("URL is required",
                assertThrows(IllegalArgumentException.class, () -> slack.validate("")).getMessage());
        assertEquals("URL must use https scheme",
                assertThrows(IllegalArgumentException.class, () -> slack.validate("http://hooks.slack.com/services/x")).getMessage());
        assertTrue(assertThrows(IllegalArgumentException.class, () -> slack.validate("https://169.254.169.254/services/x"))
                .getMessage().startsWith("URL host 169.254.169.254 is not allowed"));
        assertEquals("URL path must start with /services/",
                assertThrows(IllegalArgumentException.class, () -> slack.validate("https://hooks.slack.com/api/x")).getMessage());
        assertFalse(slack.isValid("https://hooks.slack.com:8443/services/x"));
    }

    @Test
    void validate_noRestrictionsBeyondScheme() {
        UrlValidator any = new UrlValidator("");
        assertTrue(any.isValid("ftp://files.example.com/x"));
        assertFalse(any.isValid("not a url"));
    }
}
