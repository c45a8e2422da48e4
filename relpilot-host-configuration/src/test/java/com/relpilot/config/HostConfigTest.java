package com.relpilot.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HostConfigTest {

    @Test
    void fromEnvironment_emptyEnvUsesDefaults() {
        HostConfig config = HostConfig.fromEnvironment(Map.of("HOME", "/home/rel"));

        assertEquals(Duration.ofSeconds(60), config.getStartTimeout());
        assertEquals(Duration.ofSeconds(30), config.getPluginTimeout());
        assertEquals(Duration.ofMinutes(2), config.getHookTimeout());
        assertEquals(10, config.getMaxConcurrency());
        assertEquals(Duration.ofSeconds(5), config.getGetInfoTimeout());
        assertFalse(config.isDryRun());
        assertEquals(List.of(
                Paths.get("/home/rel/.relpilot/plugins"),
                Paths.get(".relpilot/plugins"),
                Paths.get("/usr/local/lib/relpilot/plugins"),
                Paths.get("/usr/lib/relpilot/plugins")), config.getPluginDirs());
    }

    @Test
    void fromEnvironment_readsOverrides() {
        HostConfig config = HostConfig.fromEnvironment(Map.of(
                "RELPILOT_PLUGIN_DIRS", " /opt/plugins , ,/srv/plugins",
                "RELPILOT_PLUGIN_START_TIMEOUT_SECONDS", "5",
                "RELPILOT_PLUGIN_TIMEOUT_SECONDS", "7",
                "RELPILOT_HOOK_TIMEOUT_SECONDS", "9",
                "RELPILOT_PLUGIN_MAX_CONCURRENCY", "3",
                "RELPILOT_GET_INFO_TIMEOUT_MILLIS", "250",
                "RELPILOT_DRY_RUN", "1"));

        assertEquals(List.of(Paths.get("/opt/plugins"), Paths.get("/srv/plugins")), config.getPluginDirs());
        assertEquals(Duration.ofSeconds(5), config.getStartTimeout());
        assertEquals(Duration.ofSeconds(7), config.getPluginTimeout());
        assertEquals(Duration.ofSeconds(9), config.getHookTimeout());
        assertEquals(3, config.getMaxConcurrency());
        assertEquals(Duration.ofMillis(250), config.getGetInfoTimeout());
        assertTrue(config.isDryRun());
    }

    @Test
    void fromEnvironment_invalidNumbersFallBackToDefaults() {
        HostConfig config = HostConfig.fromEnvironment(Map.of(
                "RELPILOT_PLUGIN_TIMEOUT_SECONDS", "soon",
                "RELPILOT_PLUGIN_MAX_CONCURRENCY", "-4",
                "RELPILOT_HOOK_TIMEOUT_SECONDS", "0"));

        assertEquals(Duration.ofSeconds(30), config.getPluginTimeout());
        assertEquals(10, config.getMaxConcurrency());
        assertEquals(Duration.ofSeconds(120), config.getHookTimeout());
    }

    @Test
    void builder_rejectsNonPositiveValues() {
        assertThrows(IllegalArgumentException.class, () -> HostConfig.builder().maxConcurrency(0));
        assertThrows(IllegalArgumentException.class, () -> HostConfig.builder().pluginTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> HostConfig.builder().hookTimeout(Duration.ofSeconds(-1)));
    }

    @Test
    void toBuilder_copiesEverySetting() {
        HostConfig original = HostConfig.builder()
                .pluginDirs(List.of(Path.of("/a")))
                .pluginDir(Path.of("/b"))
                .maxConcurrency(2)
                .dryRun(true)
                .build();

        HostConfig copy = original.toBuilder().hookTimeout(Duration.ofSeconds(1)).build();

        assertEquals(List.of(Path.of("/a"), Path.of("/b")), copy.getPluginDirs());
        assertEquals(2, copy.getMaxConcurrency());
        assertTrue(copy.isDryRun());
        assertEquals(Duration.ofSeconds(1), copy.getHookTimeout());
        assertEquals(Duration.ofSeconds(120), original.getHookTimeout());
    }

    @Test
    void pluginDirs_areUnmodifiable() {
        HostConfig config = HostConfig.builder().pluginDirs(List.of(Path.of("/a"))).build();
        assertThrows(UnsupportedOperationException.class, () -> config.getPluginDirs().add(Path.of("/b")));
    }
}
