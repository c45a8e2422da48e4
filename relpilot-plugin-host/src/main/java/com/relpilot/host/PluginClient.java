package com.relpilot.host;

import com.relpilot.plugin.PluginException;
import com.relpilot.protocol.PluginRpcClient;
import com.relpilot.protocol.ReattachConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Host handle on one plugin: the RPC connection and, when the host spawned it, the child process.
 * {@link #kill()} closes the connection, then waits for the process to exit on its own before
 * destroying it.
 */
public final class PluginClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginClient.class);

    static final Duration GRACEFUL_EXIT_WAIT = Duration.ofSeconds(2);

    private final String name;
    private final PluginRpcClient rpc;
    private final Process process;
    private final ReattachConfig reattachConfig;
    private final AtomicBoolean killed = new AtomicBoolean();

    PluginClient(String name, PluginRpcClient rpc, Process process, ReattachConfig reattachConfig) {
        this.name = Objects.requireNonNull(name, "name");
        this.rpc = Objects.requireNonNull(rpc, "rpc");
        this.process = process;
        this.reattachConfig = reattachConfig;
    }

    /**
     * Attaches to a plugin server that is already running (for instance one started with
     * {@code PluginServer.serveTest}). No process is owned; {@link #kill()} only disconnects.
     */
    public static PluginClient reattach(ReattachConfig config, String name, Duration getInfoTimeout)
            throws PluginException {
        PluginRpcClient rpc = PluginRpcClient.connect(config, name, getInfoTimeout);
        log.debug("Reattached to plugin {} at {}:{}", name, config.host(), config.port());
        return new PluginClient(name, rpc, null, config);
    }

    public static PluginClient reattach(ReattachConfig config) throws PluginException {
        return reattach(config, "plugin", PluginRpcClient.DEFAULT_GET_INFO_TIMEOUT);
    }

    /** The plugin as seen by the host. Calls fail with an RPC error once the client is killed. */
    public PluginRpcClient plugin() {
        return rpc;
    }

    public String getName() {
        return name;
    }

    public ReattachConfig reattachConfig() {
        return reattachConfig;
    }

    /** True when this client spawned the plugin process. */
    public boolean ownsProcess() {
        return process != null;
    }

    /** True once the connection is gone or the owned process has exited. */
    public boolean isExited() {
        return rpc.isClosed() || (process != null && !process.isAlive());
    }

    /** Disconnects and stops the owned process. Safe to call more than once. */
    public void kill() {
        if (!killed.compareAndSet(false, true)) {
            return;
        }
        rpc.close();
        if (process == null) {
            return;
        }
        try {
            if (process.waitFor(GRACEFUL_EXIT_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Plugin {} exited with status {}", name, process.exitValue());
                return;
            }
            log.debug("Plugin {} still running, terminating", name);
            process.destroy();
            if (process.waitFor(GRACEFUL_EXIT_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
            log.warn("Plugin {} did not terminate, killing forcibly", name);
            process.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    @Override
    public void close() {
        kill();
    }
}
