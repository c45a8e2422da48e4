package com.relpilot.plugin;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandshakeTest {

    @Test
    void isPlugin_trueOnlyForExactCookieValue() {
        assertTrue(Handshake.isPlugin(Map.of(Handshake.MAGIC_COOKIE_KEY, Handshake.MAGIC_COOKIE_VALUE)));
    }

    @Test
    void isPlugin_falseWhenAbsentOrDifferent() {
        assertFalse(Handshake.isPlugin(Map.of()));
        assertFalse(Handshake.isPlugin(null));
        assertFalse(Handshake.isPlugin(Map.of(Handshake.MAGIC_COOKIE_KEY, "")));
        assertFalse(Handshake.isPlugin(Map.of(Handshake.MAGIC_COOKIE_KEY, Handshake.MAGIC_COOKIE_VALUE + " ")));
        assertFalse(Handshake.isPlugin(Map.of(Handshake.MAGIC_COOKIE_KEY, Handshake.MAGIC_COOKIE_VALUE.toUpperCase())));
        assertFalse(Handshake.isPlugin(Map.of("OTHER_COOKIE", Handshake.MAGIC_COOKIE_VALUE)));
    }

    @Test
    void isPlugin_togglingVariableFlipsResult() {
        Map<String, String> env = new HashMap<>();
        assertFalse(Handshake.isPlugin(env));
        env.put(Handshake.MAGIC_COOKIE_KEY, Handshake.MAGIC_COOKIE_VALUE);
        assertTrue(Handshake.isPlugin(env));
        env.remove(Handshake.MAGIC_COOKIE_KEY);
        assertFalse(Handshake.isPlugin(env));
    }
}
