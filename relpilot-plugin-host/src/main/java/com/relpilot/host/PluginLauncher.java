package com.relpilot.host;

import com.relpilot.config.HostConfig;
import com.relpilot.plugin.Handshake;
import com.relpilot.plugin.HandshakeException;
import com.relpilot.plugin.PluginException;
import com.relpilot.protocol.PluginRpcClient;
import com.relpilot.protocol.ReattachConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spawns plugin binaries and performs the handshake.
 * <p>
 * The child gets the magic cookie and the supported protocol versions in its environment. Its
 * stderr is forwarded line by line to the logger {@code relpilot.plugin.<name>}; the first stdout
 * line must be the handshake line and arrive within the start timeout. Later stdout lines are
 * logged at debug.
 */
public final class PluginLauncher {

    private static final Logger log = LoggerFactory.getLogger(PluginLauncher.class);

    public static final String PLUGIN_LOGGER_PREFIX = "relpilot.plugin.";

    private final Duration startTimeout;
    private final Duration getInfoTimeout;

    public PluginLauncher(HostConfig config) {
        this(config.getStartTimeout(), config.getGetInfoTimeout());
    }

    public PluginLauncher(Duration startTimeout, Duration getInfoTimeout) {
        this.startTimeout = Objects.requireNonNull(startTimeout, "startTimeout");
        this.getInfoTimeout = Objects.requireNonNull(getInfoTimeout, "getInfoTimeout");
    }

    /**
     * Starts {@code binary} and connects to it.
     *
     * @throws HandshakeException  when the plugin prints a malformed or incompatible handshake line,
     *                             or exits before printing one
     * @throws PluginLoadException when the process cannot be started or misses the start timeout
     * @throws PluginException     when the plugin's server cannot be reached
     */
    public PluginClient launch(String name, Path binary) throws PluginException {
        return launch(name, List.of(binary.toString()), Map.of());
    }

    /**
     * Starts {@code command} with {@code extraEnv} added to the inherited environment and connects
     * to it.
     */
    public PluginClient launch(String name, List<String> command, Map<String, String> extraEnv)
            throws PluginException {
        ProcessBuilder builder = new ProcessBuilder(new ArrayList<>(command));
        Map<String, String> env = builder.environment();
        env.putAll(extraEnv);
        env.put(Handshake.MAGIC_COOKIE_KEY, Handshake.MAGIC_COOKIE_VALUE);
        env.put(Handshake.PROTOCOL_VERSIONS_KEY, String.valueOf(Handshake.PROTOCOL_VERSION));

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new PluginLoadException(name, "failed to start plugin " + name + ": " + e.getMessage(), e);
        }
        log.debug("Started plugin {} (pid {}): {}", name, process.pid(), command);

        Logger pluginLog = LoggerFactory.getLogger(PLUGIN_LOGGER_PREFIX + name);
        forwardStderr(process.getErrorStream(), name, pluginLog);

        CompletableFuture<String> handshake = new CompletableFuture<>();
        Thread stdout = new Thread(() -> readStdout(process.getInputStream(), handshake, pluginLog),
                "relpilot-plugin-" + name + "-stdout");
        stdout.setDaemon(true);
        stdout.start();

        ReattachConfig config;
        try {
            String line = handshake.get(startTimeout.toMillis(), TimeUnit.MILLISECONDS);
            config = ReattachConfig.parse(line).withPid(process.pid());
        } catch (TimeoutException e) {
            process.destroyForcibly();
            throw new PluginLoadException(name, "plugin " + name + " did not complete the handshake within "
                    + startTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new PluginLoadException(name, "interrupted while waiting for plugin " + name, e);
        } catch (ExecutionException e) {
            process.destroyForcibly();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PluginLoadException(name, "failed to read handshake from plugin " + name + ": "
                    + cause.getMessage(), cause);
        } catch (HandshakeException e) {
            process.destroyForcibly();
            log.error("Plugin {} handshake failed: {} (line: {})", name, e.getMessage(), e.getHandshakeLine());
            throw e;
        }

        try {
            PluginRpcClient rpc = PluginRpcClient.connect(config, name, getInfoTimeout);
            log.debug("Plugin {} handshake complete, listening on {}:{}", name, config.host(), config.port());
            return new PluginClient(name, rpc, process, config);
        } catch (PluginException | RuntimeException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private static void readStdout(InputStream in, CompletableFuture<String> handshake, Logger pluginLog) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            // null here means the process closed stdout before the handshake; parse reports it
            handshake.complete(reader.readLine());
            String line;
            while ((line = reader.readLine()) != null) {
                pluginLog.debug("stdout: {}", line);
            }
        } catch (IOException e) {
            if (!handshake.completeExceptionally(e)) {
                log.debug("Plugin stdout closed: {}", e.getMessage());
            }
        }
    }

    private static void forwardStderr(InputStream in, String name, Logger pluginLog) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    pluginLog.info(line);
                }
            } catch (IOException e) {
                log.debug("Plugin {} stderr closed: {}", name, e.getMessage());
            }
        }, "relpilot-plugin-" + name + "-stderr");
        thread.setDaemon(true);
        thread.start();
    }
}
