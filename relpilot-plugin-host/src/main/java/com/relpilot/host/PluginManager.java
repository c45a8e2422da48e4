package com.relpilot.host;

import com.relpilot.config.HostConfig;
import com.relpilot.config.PluginConfig;
import com.relpilot.plugin.CallContext;
import com.relpilot.plugin.ExecuteRequest;
import com.relpilot.plugin.ExecuteResponse;
import com.relpilot.plugin.Hook;
import com.relpilot.plugin.Info;
import com.relpilot.plugin.PluginException;
import com.relpilot.plugin.ReleaseContext;
import com.relpilot.plugin.ValidateResponse;
import com.relpilot.plugin.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Host-side plugin lifecycle: loads configured plugins (eagerly or on first use), runs hooks
 * across them and shuts them down.
 * <p>
 * A hook runs every loaded plugin that supports it in parallel, at most
 * {@link HostConfig#getMaxConcurrency()} at a time. Each plugin runs under its own timeout and all
 * of them under {@link HostConfig#getHookTimeout()}. A plugin that fails, times out or cannot be
 * reached yields a {@code success=false} response; it never fails the hook as a whole. Responses
 * come back in plugin registration order.
 */
public final class PluginManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    /** Extra wait for a worker to report after the hook deadline passed. */
    private static final Duration JOIN_GRACE = Duration.ofSeconds(1);

    private final HostConfig hostConfig;
    private final List<PluginConfig> configs;
    private final Map<String, Integer> indexByName;
    private final PluginConnector connector;
    private final PluginAuditLog audit;
    private final Semaphore executionSlots;
    private final ExecutorService executor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, LoadedPlugin> plugins = new HashMap<>();
    private final Map<String, PluginConfig> pending = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<LoadedPlugin>> loads = new HashMap<>();

    public PluginManager(HostConfig hostConfig, List<PluginConfig> configs) {
        this(hostConfig, configs, new ProcessPluginConnector(hostConfig));
    }

    public PluginManager(HostConfig hostConfig, List<PluginConfig> configs, PluginConnector connector) {
        this(hostConfig, configs, connector, new PluginAuditLog());
    }

    /**
     * @throws IllegalArgumentException when two configs share a name
     */
    public PluginManager(HostConfig hostConfig, List<PluginConfig> configs, PluginConnector connector,
                         PluginAuditLog audit) {
        this.hostConfig = Objects.requireNonNull(hostConfig, "hostConfig");
        this.configs = List.copyOf(Objects.requireNonNull(configs, "configs"));
        this.connector = Objects.requireNonNull(connector, "connector");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.indexByName = new HashMap<>();
        for (int i = 0; i < this.configs.size(); i++) {
            String name = this.configs.get(i).getName();
            if (indexByName.putIfAbsent(name, i) != null) {
                throw new IllegalArgumentException("Plugin configured more than once: " + name);
            }
        }
        this.executionSlots = new Semaphore(hostConfig.getMaxConcurrency());
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "relpilot-hook-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Loads every enabled plugin now. A plugin that fails to load aborts the call unless its
     * config sets {@code continueOnError}, in which case it is logged and skipped.
     */
    public void loadPlugins() throws PluginLoadException {
        for (PluginConfig cfg : configs) {
            if (!cfg.isEnabled()) {
                log.debug("Plugin {} disabled", cfg.getName());
                continue;
            }
            try {
                ensureLoaded(cfg);
            } catch (PluginLoadException e) {
                if (cfg.isContinueOnError()) {
                    log.warn("Failed to load plugin {}, continuing: {}", cfg.getName(), e.getMessage());
                    continue;
                }
                throw new PluginLoadException(cfg.getName(),
                        "failed to load plugin " + cfg.getName() + ": " + e.getMessage(), e);
            }
        }
    }

    /**
     * Registers every enabled plugin for loading on the first hook that may need it. Startup
     * stays cheap for runs that never fire a hook.
     */
    public void registerPlugins() {
        lock.writeLock().lock();
        try {
            for (PluginConfig cfg : configs) {
                if (!cfg.isEnabled()) {
                    log.debug("Plugin {} disabled", cfg.getName());
                    continue;
                }
                if (!plugins.containsKey(cfg.getName())) {
                    log.debug("Registering plugin {} for lazy loading", cfg.getName());
                    pending.put(cfg.getName(), cfg);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ExecuteResponse> executeHook(Hook hook, ReleaseContext releaseContext) {
        return executeHook(CallContext.background(), hook, releaseContext);
    }

    /**
     * Runs {@code hook} on every plugin that supports it. Cancelling {@code parent} cancels the
     * running calls.
     *
     * @return one response per plugin run, in registration order; empty when no plugin handles the hook
     */
    public List<ExecuteResponse> executeHook(CallContext parent, Hook hook, ReleaseContext releaseContext) {
        Objects.requireNonNull(hook, "hook");
        List<LoadedPlugin> targets = collectPluginsForHook(hook);
        if (targets.isEmpty()) {
            return List.of();
        }

        CallContext hookCtx = parent.withTimeout(hostConfig.getHookTimeout());
        ReleaseContext context = releaseContext != null ? releaseContext : ReleaseContext.empty();
        List<Future<ExecuteResponse>> futures = new ArrayList<>(targets.size());
        for (LoadedPlugin lp : targets) {
            futures.add(executor.submit(() -> executeOne(hookCtx, lp, hook, context)));
        }

        List<ExecuteResponse> results = new ArrayList<>(targets.size());
        try {
            for (int i = 0; i < targets.size(); i++) {
                results.add(await(futures.get(i), hookCtx, targets.get(i), hook));
            }
        } finally {
            if (hookCtx.isDeadlineExceeded()) {
                log.warn("Global hook timeout reached for {} after {}", hook, hostConfig.getHookTimeout());
            }
            hookCtx.cancel();
        }
        return results;
    }

    /** Info of a loaded plugin; empty when the plugin is unknown or not loaded yet. */
    public Optional<Info> getPluginInfo(String name) {
        lock.readLock().lock();
        try {
            LoadedPlugin lp = plugins.get(name);
            return lp != null ? Optional.of(lp.info) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Info of every loaded plugin, in registration order. */
    public List<Info> listPlugins() {
        lock.readLock().lock();
        try {
            return plugins.values().stream()
                    .sorted(Comparator.comparingInt(lp -> lp.index))
                    .map(lp -> lp.info)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isLoaded(String name) {
        lock.readLock().lock();
        try {
            return plugins.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Stops every loaded plugin and forgets registrations and remembered load errors. */
    public void shutdown() {
        List<LoadedPlugin> toStop;
        lock.writeLock().lock();
        try {
            toStop = new ArrayList<>(plugins.values());
            plugins.clear();
            pending.clear();
            loads.clear();
        } finally {
            lock.writeLock().unlock();
        }
        for (LoadedPlugin lp : toStop) {
            log.debug("Shutting down plugin {}", lp.name);
            try {
                lp.client.kill();
            } catch (RuntimeException e) {
                log.warn("Error stopping plugin {}: {}", lp.name, e.getMessage(), e);
            }
            audit.logUnload(lp.name);
        }
    }

    @Override
    public void close() {
        shutdown();
        executor.shutdownNow();
    }

    private List<LoadedPlugin> collectPluginsForHook(Hook hook) {
        List<LoadedPlugin> out = new ArrayList<>();
        List<PluginConfig> toLoad = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (PluginConfig cfg : configs) {
                LoadedPlugin lp = plugins.get(cfg.getName());
                if (lp != null) {
                    if (lp.supports(hook)) out.add(lp);
                } else if (pending.containsKey(cfg.getName()) && cfg.hasHook(hook.value())) {
                    toLoad.add(cfg);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        for (PluginConfig cfg : toLoad) {
            try {
                LoadedPlugin lp = ensureLoaded(cfg);
                if (lp.supports(hook)) out.add(lp);
            } catch (PluginLoadException e) {
                log.warn("Failed to lazy load plugin {}: {}", cfg.getName(), e.getMessage());
            }
        }
        out.sort(Comparator.comparingInt(lp -> lp.index));
        return out;
    }

    /** Loads {@code cfg} once; concurrent and later callers share the outcome, failures included. */
    private LoadedPlugin ensureLoaded(PluginConfig cfg) throws PluginLoadException {
        String name = cfg.getName();
        CompletableFuture<LoadedPlugin> future;
        boolean owner = false;
        lock.writeLock().lock();
        try {
            LoadedPlugin loaded = plugins.get(name);
            if (loaded != null) return loaded;
            future = loads.get(name);
            if (future == null) {
                future = new CompletableFuture<>();
                loads.put(name, future);
                owner = true;
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (owner) {
            try {
                LoadedPlugin lp = load(cfg);
                lock.writeLock().lock();
                try {
                    plugins.put(name, lp);
                    pending.remove(name);
                } finally {
                    lock.writeLock().unlock();
                }
                future.complete(lp);
            } catch (PluginLoadException e) {
                future.completeExceptionally(e);
            } catch (RuntimeException e) {
                future.completeExceptionally(new PluginLoadException(name,
                        "failed to load plugin " + name + ": " + e.getMessage(), e));
            }
        }

        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PluginLoadException ple) {
                throw ple;
            }
            throw new PluginLoadException(name, "failed to load plugin " + name + ": " + cause.getMessage(), cause);
        }
    }

    private LoadedPlugin load(PluginConfig cfg) throws PluginLoadException {
        String name = cfg.getName();
        PluginClient client;
        try {
            client = connector.connect(cfg);
        } catch (PluginLoadException e) {
            audit.logLoad(name, false, e.getMessage());
            throw e;
        } catch (PluginException | RuntimeException e) {
            audit.logLoad(name, false, e.getMessage());
            throw new PluginLoadException(name, "failed to connect to plugin " + name + ": " + e.getMessage(), e);
        }

        Duration timeout = cfg.timeoutOr(hostConfig.getPluginTimeout());
        try {
            Info info = client.plugin().getInfo();
            if (info.isEmpty()) {
                log.warn("Plugin {} returned no info; it will not receive hooks", name);
            }
            if (!cfg.getConfig().isEmpty()) {
                CallContext validateCtx = CallContext.background().withTimeout(timeout);
                ValidateResponse resp;
                try {
                    resp = client.plugin().validate(validateCtx, cfg.getConfig());
                } finally {
                    validateCtx.cancel();
                }
                if (!resp.valid()) {
                    throw new PluginLoadException(name, "invalid plugin configuration: " + joinErrors(resp.errors()));
                }
            }
            log.info("Plugin loaded: name={} version={} hooks={}", name, info.version(), info.hooks());
            audit.logLoad(name, true, null);
            return new LoadedPlugin(name, indexByName.get(name), client, info, cfg, timeout);
        } catch (PluginLoadException e) {
            client.kill();
            audit.logLoad(name, false, e.getMessage());
            throw e;
        } catch (PluginException | RuntimeException e) {
            client.kill();
            audit.logLoad(name, false, e.getMessage());
            throw new PluginLoadException(name, "failed to validate plugin config: " + e.getMessage(), e);
        }
    }

    private ExecuteResponse executeOne(CallContext hookCtx, LoadedPlugin lp, Hook hook, ReleaseContext context) {
        if (hookCtx.isCancelled()) {
            return ExecuteResponse.failure("execution cancelled: " + cancelReason(hookCtx));
        }
        try {
            if (!acquireSlot(hookCtx)) {
                log.error("Failed to acquire execution slot for plugin {} on {}", lp.name, hook);
                return ExecuteResponse.failure("failed to acquire execution slot: " + cancelReason(hookCtx));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecuteResponse.failure("interrupted while waiting for an execution slot");
        }

        CallContext callCtx = hookCtx.withTimeout(lp.timeout);
        try {
            log.debug("Executing {} on plugin {}", hook, lp.name);
            ExecuteRequest request = new ExecuteRequest(hook, lp.config.getConfig(), context, hostConfig.isDryRun());
            long start = System.nanoTime();
            ExecuteResponse resp;
            try {
                resp = lp.client.plugin().execute(callCtx, request);
            } catch (PluginException | RuntimeException e) {
                Duration duration = Duration.ofNanos(System.nanoTime() - start);
                if (callCtx.isDeadlineExceeded()) {
                    audit.logTimeout(lp.name, hook.value(), duration);
                } else {
                    audit.logExecution(lp.name, hook.value(), false, duration, e.getMessage());
                }
                log.error("Plugin {} failed on {}: {}", lp.name, hook, e.getMessage());
                return ExecuteResponse.failure(e.getMessage());
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - start);

            if (resp == null) {
                audit.logExecution(lp.name, hook.value(), true, duration, null);
                return ExecuteResponse.success("plugin returned no response");
            }
            if (resp.isSuccess()) {
                log.info("Plugin {} executed {} successfully", lp.name, hook);
            } else {
                log.warn("Plugin {} returned an error on {}: {}", lp.name, hook, resp.getError());
            }
            audit.logExecution(lp.name, hook.value(), resp.isSuccess(), duration, resp.getError());
            return resp;
        } finally {
            callCtx.cancel();
            executionSlots.release();
        }
    }

    private boolean acquireSlot(CallContext hookCtx) throws InterruptedException {
        Optional<Duration> remaining = hookCtx.remaining();
        if (remaining.isEmpty()) {
            executionSlots.acquire();
            return true;
        }
        return executionSlots.tryAcquire(remaining.get().toNanos(), TimeUnit.NANOSECONDS);
    }

    private ExecuteResponse await(Future<ExecuteResponse> future, CallContext hookCtx, LoadedPlugin lp, Hook hook) {
        Optional<Duration> remaining = hookCtx.remaining();
        try {
            if (remaining.isEmpty()) {
                return future.get();
            }
            return future.get(remaining.get().plus(JOIN_GRACE).toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            hookCtx.cancel();
            future.cancel(true);
            log.warn("Plugin {} did not finish {} before the hook timeout", lp.name, hook);
            return ExecuteResponse.failure("execution cancelled: hook timeout reached");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Plugin {} worker failed on {}: {}", lp.name, hook, cause.getMessage(), cause);
            return ExecuteResponse.failure(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            hookCtx.cancel();
            return ExecuteResponse.failure("interrupted while waiting for plugin " + lp.name);
        }
    }

    private static String cancelReason(CallContext ctx) {
        return ctx.isDeadlineExceeded() ? "hook timeout reached" : "cancelled";
    }

    private static String joinErrors(List<ValidationError> errors) {
        return errors.stream()
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining("; "));
    }

    private static final class LoadedPlugin {
        final String name;
        final int index;
        final PluginClient client;
        final Info info;
        final PluginConfig config;
        final Duration timeout;

        LoadedPlugin(String name, int index, PluginClient client, Info info, PluginConfig config, Duration timeout) {
            this.name = name;
            this.index = index;
            this.client = client;
            this.info = info;
            this.config = config;
            this.timeout = timeout;
        }

        boolean supports(Hook hook) {
            return config.hasHook(hook.value()) && info.supports(hook);
        }
    }
}
