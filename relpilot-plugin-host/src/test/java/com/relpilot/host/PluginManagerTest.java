package com.relpilot.host;

import com.relpilot.config.HostConfig;
import com.relpilot.config.PluginConfig;
import com.relpilot.plugin.CallContext;
import com.relpilot.plugin.ExecuteResponse;
import com.relpilot.plugin.Hook;
import com.relpilot.plugin.Info;
import com.relpilot.plugin.ReleaseContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PluginManagerTest {

    private static final ReleaseContext RELEASE = ReleaseContext.builder()
            .version("1.2.0")
            .previousVersion("1.1.0")
            .tagName("v1.2.0")
            .build();

    private final TestServerConnector connector = new TestServerConnector();
    private final List<AuditEvent> auditEvents = new CopyOnWriteArrayList<>();
    private PluginManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
        connector.close();
    }

    private PluginManager newManager(HostConfig hostConfig, PluginConfig... configs) {
        manager = new PluginManager(hostConfig, List.of(configs), connector, new PluginAuditLog(auditEvents::add));
        return manager;
    }

    private PluginManager newManager(PluginConfig... configs) {
        return newManager(HostConfig.builder().build(), configs);
    }

    private static List<String> messages(List<ExecuteResponse> responses) {
        return responses.stream().map(ExecuteResponse::getMessage).collect(Collectors.toList());
    }

    @Test
    void executeHook_returnsResultsInRegistrationOrder() throws Exception {
        connector.add("slow", new ScriptedPlugin("slow", List.of(Hook.PRE_PUBLISH), (ctx, req) -> {
            sleep(300);
            return ExecuteResponse.success("slow");
        }));
        connector.add("fast", ScriptedPlugin.succeeding("fast", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("slow").build(), PluginConfig.builder("fast").build());

        manager.loadPlugins();
        List<ExecuteResponse> results = manager.executeHook(Hook.PRE_PUBLISH, RELEASE);

        assertEquals(List.of("slow", "fast"), messages(results));
        assertTrue(results.stream().allMatch(ExecuteResponse::isSuccess));
    }

    @Test
    void executeHook_passesReleaseContextConfigAndDryRun() throws Exception {
        connector.add("github", new ScriptedPlugin("github", List.of(Hook.POST_PUBLISH), (ctx, req) ->
                ExecuteResponse.builder()
                        .success(true)
                        .message("released " + req.context().getVersion())
                        .output("dryRun", req.dryRun())
                        .output("token", req.config().get("token"))
                        .output("hook", req.hook().value())
                        .build()));
        newManager(HostConfig.builder().dryRun(true).build(),
                PluginConfig.builder("github").config(Map.of("token", "t0k")).build());

        manager.loadPlugins();
        ExecuteResponse resp = manager.executeHook(Hook.POST_PUBLISH, RELEASE).get(0);

        assertTrue(resp.isSuccess());
        assertEquals("released 1.2.0", resp.getMessage());
        assertEquals(true, resp.getOutputs().get("dryRun"));
        assertEquals("t0k", resp.getOutputs().get("token"));
        assertEquals("post-publish", resp.getOutputs().get("hook"));
    }

    @Test
    void executeHook_onlyRunsPluginsSupportingTheHook() throws Exception {
        ScriptedPlugin pre = ScriptedPlugin.succeeding("pre", Hook.PRE_PUBLISH);
        ScriptedPlugin post = ScriptedPlugin.succeeding("post", Hook.POST_PUBLISH);
        ScriptedPlugin both = ScriptedPlugin.succeeding("both", Hook.PRE_PUBLISH, Hook.POST_PUBLISH);
        connector.add("pre", pre).add("post", post).add("both", both);
        newManager(PluginConfig.builder("pre").build(),
                PluginConfig.builder("post").build(),
                PluginConfig.builder("both").hooks("post-publish").build());

        manager.loadPlugins();

        assertEquals(List.of("pre"), messages(manager.executeHook(Hook.PRE_PUBLISH, RELEASE)));
        assertEquals(List.of("post", "both"), messages(manager.executeHook(Hook.POST_PUBLISH, RELEASE)));
        assertTrue(manager.executeHook(Hook.ON_ERROR, RELEASE).isEmpty());
        assertEquals(1, both.executions.get());
    }

    @Test
    void executeHook_pluginExceptionBecomesFailureResponse() throws Exception {
        connector.add("broken", new ScriptedPlugin("broken", List.of(Hook.ON_ERROR), (ctx, req) -> {
            throw new IllegalStateException("registry unavailable");
        }));
        connector.add("ok", ScriptedPlugin.succeeding("ok", Hook.ON_ERROR));
        newManager(PluginConfig.builder("broken").build(), PluginConfig.builder("ok").build());

        manager.loadPlugins();
        List<ExecuteResponse> results = manager.executeHook(Hook.ON_ERROR, RELEASE);

        assertEquals(2, results.size());
        assertFalse(results.get(0).isSuccess());
        assertEquals("registry unavailable", results.get(0).getError());
        assertTrue(results.get(1).isSuccess());
        assertTrue(auditEvents.stream().anyMatch(e -> e.type() == AuditEvent.Type.EXECUTE
                && e.pluginName().equals("broken") && !e.success()));
    }

    @Test
    void executeHook_perPluginTimeoutOnlyFailsThatPlugin() throws Exception {
        connector.add("hang", ScriptedPlugin.hanging("hang", Hook.PRE_PUBLISH));
        connector.add("ok", ScriptedPlugin.succeeding("ok", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("hang").timeout(Duration.ofMillis(300)).build(),
                PluginConfig.builder("ok").build());

        manager.loadPlugins();
        long start = System.nanoTime();
        List<ExecuteResponse> results = manager.executeHook(Hook.PRE_PUBLISH, RELEASE);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertFalse(results.get(0).isSuccess());
        assertTrue(results.get(0).getError().contains("timed out"), results.get(0).getError());
        assertTrue(results.get(1).isSuccess());
        assertTrue(elapsedMillis < 5_000, "took " + elapsedMillis + "ms");
        assertTrue(auditEvents.stream().anyMatch(e -> e.type() == AuditEvent.Type.TIMEOUT
                && e.pluginName().equals("hang")));
    }

    @Test
    void executeHook_globalHookTimeoutBoundsAllPlugins() throws Exception {
        connector.add("hang", ScriptedPlugin.hanging("hang", Hook.PRE_PUBLISH));
        newManager(HostConfig.builder().hookTimeout(Duration.ofMillis(400)).build(),
                PluginConfig.builder("hang").build());

        manager.loadPlugins();
        long start = System.nanoTime();
        List<ExecuteResponse> results = manager.executeHook(Hook.PRE_PUBLISH, RELEASE);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(1, results.size());
        assertFalse(results.get(0).isSuccess());
        assertTrue(results.get(0).getError().contains("timed out"), results.get(0).getError());
        assertTrue(elapsedMillis < 5_000, "took " + elapsedMillis + "ms");
    }

    @Test
    void executeHook_parentCancellationCancelsCalls() throws Exception {
        connector.add("hang", ScriptedPlugin.hanging("hang", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("hang").build());
        manager.loadPlugins();

        CallContext parent = CallContext.background();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(parent::cancel, 200, TimeUnit.MILLISECONDS);
            List<ExecuteResponse> results = manager.executeHook(parent, Hook.PRE_PUBLISH, RELEASE);

            assertFalse(results.get(0).isSuccess());
            assertTrue(results.get(0).getError().contains("cancelled"), results.get(0).getError());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void executeHook_repeatedCallsOnSharedParentLeaveNoListeners() throws Exception {
        connector.add("echo", ScriptedPlugin.succeeding("echo", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("echo").build());
        manager.loadPlugins();

        CallContext parent = CallContext.background();
        for (int i = 0; i < 200; i++) {
            assertTrue(manager.executeHook(parent, Hook.PRE_PUBLISH, RELEASE).get(0).isSuccess());
        }

        assertEquals(0, parent.cancelListenerCount());
    }

    @Test
    void executeHook_respectsMaxConcurrency() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        ScriptedPlugin.Action tracked = (ctx, req) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            sleep(100);
            active.decrementAndGet();
            return ExecuteResponse.success("done");
        };
        connector.add("a", new ScriptedPlugin("a", List.of(Hook.PRE_PUBLISH), tracked));
        connector.add("b", new ScriptedPlugin("b", List.of(Hook.PRE_PUBLISH), tracked));
        connector.add("c", new ScriptedPlugin("c", List.of(Hook.PRE_PUBLISH), tracked));
        newManager(HostConfig.builder().maxConcurrency(1).build(),
                PluginConfig.builder("a").build(),
                PluginConfig.builder("b").build(),
                PluginConfig.builder("c").build());

        manager.loadPlugins();
        List<ExecuteResponse> results = manager.executeHook(Hook.PRE_PUBLISH, RELEASE);

        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(ExecuteResponse::isSuccess));
        assertEquals(1, maxActive.get());
    }

    @Test
    void loadPlugins_invalidConfigFailsWithFieldMessages() {
        connector.add("slack", ScriptedPlugin.succeeding("slack", Hook.POST_PUBLISH));
        newManager(PluginConfig.builder("slack").config(Map.of("channel", "#releases")).build());

        PluginLoadException e = assertThrows(PluginLoadException.class, () -> manager.loadPlugins());

        assertEquals("slack", e.getPluginName());
        assertTrue(e.getMessage().contains("invalid plugin configuration: token: token is required"), e.getMessage());
        assertFalse(manager.isLoaded("slack"));
        assertTrue(auditEvents.stream().anyMatch(ev -> ev.type() == AuditEvent.Type.LOAD && !ev.success()));
    }

    @Test
    void loadPlugins_continueOnErrorSkipsFailingPlugin() throws Exception {
        connector.add("good", ScriptedPlugin.succeeding("good", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("missing").continueOnError(true).build(),
                PluginConfig.builder("good").build());

        manager.loadPlugins();

        assertFalse(manager.isLoaded("missing"));
        assertTrue(manager.isLoaded("good"));
        assertEquals(List.of("good"), messages(manager.executeHook(Hook.PRE_PUBLISH, RELEASE)));
    }

    @Test
    void loadPlugins_skipsDisabledPlugins() throws Exception {
        connector.add("off", ScriptedPlugin.succeeding("off", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("off").enabled(false).build());

        manager.loadPlugins();
        manager.registerPlugins();

        assertEquals(0, connector.connects("off"));
        assertTrue(manager.executeHook(Hook.PRE_PUBLISH, RELEASE).isEmpty());
    }

    @Test
    void registerPlugins_loadsLazilyAndOnlyOnce() {
        connector.add("lazy", ScriptedPlugin.succeeding("lazy", Hook.PRE_PUBLISH, Hook.POST_PUBLISH));
        newManager(PluginConfig.builder("lazy").build());

        manager.registerPlugins();
        assertEquals(0, connector.connects("lazy"));
        assertFalse(manager.isLoaded("lazy"));

        assertEquals(List.of("lazy"), messages(manager.executeHook(Hook.PRE_PUBLISH, RELEASE)));
        assertEquals(List.of("lazy"), messages(manager.executeHook(Hook.POST_PUBLISH, RELEASE)));

        assertEquals(1, connector.connects("lazy"));
        assertTrue(manager.isLoaded("lazy"));
    }

    @Test
    void registerPlugins_configuredHooksAvoidNeedlessLoads() {
        connector.add("notify", ScriptedPlugin.succeeding("notify", Hook.POST_PUBLISH));
        newManager(PluginConfig.builder("notify").hooks("post-publish").build());

        manager.registerPlugins();

        assertTrue(manager.executeHook(Hook.PRE_PUBLISH, RELEASE).isEmpty());
        assertEquals(0, connector.connects("notify"));
        assertEquals(List.of("notify"), messages(manager.executeHook(Hook.POST_PUBLISH, RELEASE)));
    }

    @Test
    void registerPlugins_loadErrorIsRemembered() {
        connector.add("ok", ScriptedPlugin.succeeding("ok", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("ghost").build(), PluginConfig.builder("ok").build());

        manager.registerPlugins();
        assertEquals(List.of("ok"), messages(manager.executeHook(Hook.PRE_PUBLISH, RELEASE)));
        assertEquals(List.of("ok"), messages(manager.executeHook(Hook.PRE_PUBLISH, RELEASE)));

        assertEquals(1, connector.connects("ghost"));
    }

    @Test
    void pluginInfo_listAndLookup() throws Exception {
        connector.add("one", ScriptedPlugin.succeeding("one", Hook.PRE_PUBLISH));
        connector.add("two", ScriptedPlugin.succeeding("two", Hook.POST_PUBLISH));
        newManager(PluginConfig.builder("one").build(), PluginConfig.builder("two").build());

        manager.loadPlugins();

        assertEquals(List.of("one", "two"),
                manager.listPlugins().stream().map(Info::name).collect(Collectors.toList()));
        Info two = manager.getPluginInfo("two").orElseThrow();
        assertEquals("1.0.0", two.version());
        assertEquals(List.of(Hook.POST_PUBLISH), two.hooks());
        assertTrue(manager.getPluginInfo("three").isEmpty());
    }

    @Test
    void shutdown_unloadsEveryPlugin() throws Exception {
        connector.add("one", ScriptedPlugin.succeeding("one", Hook.PRE_PUBLISH));
        newManager(PluginConfig.builder("one").build());
        manager.loadPlugins();

        manager.shutdown();

        assertFalse(manager.isLoaded("one"));
        assertTrue(manager.listPlugins().isEmpty());
        assertTrue(manager.executeHook(Hook.PRE_PUBLISH, RELEASE).isEmpty());
        assertTrue(auditEvents.stream().anyMatch(e -> e.type() == AuditEvent.Type.UNLOAD
                && e.pluginName().equals("one")));
    }

    @Test
    void constructor_rejectsDuplicateNames() {
        assertThrows(IllegalArgumentException.class, () -> newManager(
                PluginConfig.builder("dup").build(), PluginConfig.builder("dup").build()));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
