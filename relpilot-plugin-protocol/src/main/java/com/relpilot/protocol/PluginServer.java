package com.relpilot.protocol;

import com.relpilot.plugin.Handshake;
import com.relpilot.plugin.Plugin;
import com.relpilot.plugin.ResourceCleanup;
import io.grpc.Attributes;
import io.grpc.Server;
import io.grpc.ServerTransportFilter;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry points for running a {@link Plugin} implementation as a gRPC plugin server.
 * <p>
 * Real plugin binaries call {@link #serve(Plugin)} from {@code main}:
 * <pre>{@code
 * public static void main(String[] args) {
 *     PluginServer.serve(new GitHubPlugin());
 * }
 * }</pre>
 * Tests call {@link #serveTest(Plugin)} and attach with {@link PluginRpcClient#connect(ReattachConfig)}.
 */
public final class PluginServer {

    private static final Logger log = LoggerFactory.getLogger(PluginServer.class);
    private static final long CLOSE_WAIT_SECONDS = 5;

    static final String NOT_A_PLUGIN_MESSAGE =
            "This binary is a relpilot plugin. It is not meant to be executed directly.\n"
                    + "Configure it in relpilot and let relpilot launch it.";

    private PluginServer() {
    }

    /**
     * Serves {@code impl} to the host that launched this process and returns once the host
     * disconnects. Exits the JVM with status 1 when the process was not launched by a host or the
     * port cannot be bound.
     */
    public static void serve(Plugin impl) {
        int code = runServe(impl, System.getenv(), System.out, System.err,
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        if (code != 0) {
            System.exit(code);
        }
    }

    /** Body of {@link #serve(Plugin)}; returns the exit status instead of exiting. */
    static int runServe(Plugin impl, Map<String, String> env, PrintStream out, PrintStream err,
                        InetSocketAddress bindAddress) {
        if (!Handshake.isPlugin(env)) {
            err.println(NOT_A_PLUGIN_MESSAGE);
            err.flush();
            return 1;
        }
        HostConnections connections = new HostConnections();
        Server server;
        try {
            server = start(impl, bindAddress, connections);
        } catch (IOException e) {
            log.error("Plugin server failed to bind {}: {}", bindAddress, e.getMessage(), e);
            return 1;
        }
        try {
            ReattachConfig config = ReattachConfig.of(
                    new InetSocketAddress(bindAddress.getAddress(), server.getPort()));
            out.println(config.toHandshakeLine());
            out.flush();
            connections.awaitHostGone();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } finally {
            stop(server);
            cleanup(impl);
        }
    }

    /**
     * Starts a server for {@code impl} and returns once it is listening. Any number of clients may
     * attach until the returned server is closed.
     *
     * @throws PluginServeException when the port cannot be bound
     */
    public static TestServer serveTest(Plugin impl) {
        return serveTest(impl, new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
    }

    static TestServer serveTest(Plugin impl, InetSocketAddress bindAddress) {
        Server server;
        try {
            server = start(impl, bindAddress, new HostConnections());
        } catch (IOException e) {
            throw new PluginServeException("plugin test server failed to start: " + e.getMessage(), e);
        }
        ReattachConfig config = ReattachConfig.of(new InetSocketAddress(bindAddress.getAddress(), server.getPort()));
        return new TestServer(config, () -> {
            server.shutdownNow();
            stop(server);
            cleanup(impl);
        });
    }

    private static Server start(Plugin impl, InetSocketAddress bindAddress, HostConnections connections)
            throws IOException {
        return NettyServerBuilder.forAddress(bindAddress)
                .addService(new PluginGrpcService(impl, impl.getClass().getSimpleName()))
                .addTransportFilter(connections)
                .build()
                .start();
    }

    private static void stop(Server server) {
        server.shutdown();
        try {
            if (!server.awaitTermination(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Plugin server did not stop within {}s, forcing shutdown", CLOSE_WAIT_SECONDS);
                server.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdownNow();
        }
    }

    private static void cleanup(Plugin impl) {
        if (impl instanceof ResourceCleanup cleanup) {
            try {
                cleanup.onExit();
            } catch (RuntimeException e) {
                log.warn("Plugin cleanup failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Counts host transports. The host is gone once a transport became ready and every ready
     * transport terminated again.
     */
    private static final class HostConnections extends ServerTransportFilter {

        private static final Attributes.Key<Boolean> READY = Attributes.Key.create("relpilot.host.ready");

        private final AtomicInteger open = new AtomicInteger();
        private final CountDownLatch gone = new CountDownLatch(1);

        @Override
        public Attributes transportReady(Attributes attrs) {
            int count = open.incrementAndGet();
            log.debug("Host connected ({} open)", count);
            return attrs.toBuilder().set(READY, Boolean.TRUE).build();
        }

        @Override
        public void transportTerminated(Attributes attrs) {
            if (attrs == null || !Boolean.TRUE.equals(attrs.get(READY))) {
                return;
            }
            int count = open.decrementAndGet();
            log.debug("Host disconnected ({} open)", count);
            if (count == 0) {
                gone.countDown();
            }
        }

        void awaitHostGone() throws InterruptedException {
            gone.await();
        }
    }
}
