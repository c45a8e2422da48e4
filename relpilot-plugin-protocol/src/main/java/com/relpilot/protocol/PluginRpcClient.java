package com.relpilot.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.relpilot.plugin.CallContext;
import com.relpilot.plugin.ExecuteRequest;
import com.relpilot.plugin.ExecuteResponse;
import com.relpilot.plugin.Info;
import com.relpilot.plugin.Plugin;
import com.relpilot.plugin.PluginException;
import com.relpilot.plugin.ValidateResponse;
import com.relpilot.plugin.progress.Progress;
import com.relpilot.protocol.streaming.ProgressCallback;
import com.relpilot.protocol.streaming.StreamingClient;
import com.relpilot.protocol.wire.ExecuteEvent;
import com.relpilot.protocol.wire.ExecuteRequestMessage;
import com.relpilot.protocol.wire.ExecuteResponseMessage;
import com.relpilot.protocol.wire.GetInfoRequest;
import com.relpilot.protocol.wire.NotificationMessage;
import com.relpilot.protocol.wire.PluginServiceGrpc;
import com.relpilot.protocol.wire.ValidateEvent;
import com.relpilot.protocol.wire.ValidateRequestMessage;
import com.relpilot.protocol.wire.WireConverter;
import io.grpc.ConnectivityState;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Host-side {@link Plugin} backed by a gRPC channel to a plugin process.
 * <p>
 * {@link #getInfo()} is bounded by a timeout (5 seconds by default) and degrades to
 * {@link Info#empty()}. {@link #execute} and {@link #validate} are bounded only by the caller's
 * {@link CallContext}: its deadline becomes the call deadline and cancelling it cancels the call.
 * Notifications the plugin streams during a call are dispatched on the calling thread before the
 * call returns.
 */
public final class PluginRpcClient implements Plugin, Closeable {

    private static final Logger log = LoggerFactory.getLogger(PluginRpcClient.class);

    public static final Duration DEFAULT_GET_INFO_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final long CLOSE_WAIT_SECONDS = 5;

    private final String name;
    private final ManagedChannel channel;
    private final PluginServiceGrpc.PluginServiceBlockingStub stub;
    private final StreamingClient streaming;
    private final Duration getInfoTimeout;
    private final AtomicBoolean closed = new AtomicBoolean();

    public PluginRpcClient(String name, ManagedChannel channel, StreamingClient streaming, Duration getInfoTimeout) {
        this.name = name;
        this.channel = channel;
        this.stub = PluginServiceGrpc.newBlockingStub(channel);
        this.streaming = streaming;
        this.getInfoTimeout = getInfoTimeout != null ? getInfoTimeout : DEFAULT_GET_INFO_TIMEOUT;
    }

    public static PluginRpcClient connect(ReattachConfig config) throws PluginException {
        return connect(config, "plugin", DEFAULT_GET_INFO_TIMEOUT);
    }

    /**
     * Opens a channel to a running plugin server and waits until it is connected.
     *
     * @param name           plugin name, used for logging
     * @param getInfoTimeout bound for {@link #getInfo()}
     * @throws RpcException when the server cannot be reached
     */
    public static PluginRpcClient connect(ReattachConfig config, String name, Duration getInfoTimeout)
            throws PluginException {
        ManagedChannel channel = ManagedChannelBuilder.forAddress(config.host(), config.port())
                .usePlaintext()
                .build();
        try {
            if (!awaitReady(channel, CONNECT_TIMEOUT)) {
                channel.shutdownNow();
                throw new RpcException(Status.Code.UNAVAILABLE, "failed to connect to plugin " + name + " at "
                        + config.host() + ":" + config.port() + ": not ready within " + CONNECT_TIMEOUT.toSeconds()
                        + "s", null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.shutdownNow();
            throw new RpcException("interrupted while connecting to plugin " + name, e);
        }
        log.debug("Connected to plugin {} at {}:{}", name, config.host(), config.port());
        return new PluginRpcClient(name, channel, new StreamingClient(name), getInfoTimeout);
    }

    @Override
    public Info getInfo() {
        if (isClosed()) {
            log.warn("GetInfo skipped for plugin {}: client is closed", name);
            return Info.empty();
        }
        try {
            return WireConverter.fromWire(stub.withDeadlineAfter(getInfoTimeout.toNanos(), TimeUnit.NANOSECONDS)
                    .getInfo(GetInfoRequest.getDefaultInstance()));
        } catch (StatusRuntimeException e) {
            log.warn("GetInfo failed for plugin {}: {}", name, e.getStatus());
            return Info.empty();
        }
    }

    @Override
    public ExecuteResponse execute(CallContext ctx, ExecuteRequest request) throws PluginException {
        return executeWithProgress(ctx, request, null);
    }

    /**
     * Like {@link #execute} but also delivers the call's progress events to {@code callback} while
     * the call runs.
     */
    public ExecuteResponse executeWithProgress(CallContext ctx, ExecuteRequest request, ProgressCallback callback)
            throws PluginException {
        ExecuteRequestMessage msg = ExecuteRequestMessage.newBuilder()
                .setHook(WireConverter.toWire(request.hook()))
                .setConfig(encodeConfig(request.config()))
                .setContext(WireConverter.toWire(request.context()))
                .setDryRun(request.dryRun())
                .build();

        ExecuteResponseMessage resp = invoke(ctx, "Execute", s -> {
            Iterator<ExecuteEvent> events = s.execute(msg);
            while (events.hasNext()) {
                ExecuteEvent event = events.next();
                switch (event.getEventCase()) {
                    case NOTIFICATION -> dispatch(event.getNotification(), callback);
                    case RESPONSE -> {
                        return event.getResponse();
                    }
                    default -> log.debug("Ignoring empty Execute event from plugin {}", name);
                }
            }
            return null;
        });
        if (resp == null) {
            throw new RpcException("Execute returned no result");
        }

        ExecuteResponse.Builder builder = ExecuteResponse.builder()
                .success(resp.getSuccess())
                .message(resp.getMessage())
                .error(resp.getError())
                .artifacts(WireConverter.fromWireArtifacts(resp.getArtifactsList()));
        try {
            builder.outputs(WireConverter.decodeMap(resp.getOutputs()));
        } catch (JsonProcessingException e) {
            String prior = !resp.getError().isEmpty() ? resp.getError() + "; " : "";
            builder.success(false).error(prior + "invalid outputs JSON: " + e.getOriginalMessage());
        }
        return builder.build();
    }

    @Override
    public ValidateResponse validate(CallContext ctx, Map<String, Object> config) throws PluginException {
        ValidateRequestMessage msg = ValidateRequestMessage.newBuilder().setConfig(encodeConfig(config)).build();
        ValidateResponse resp = invoke(ctx, "Validate", s -> {
            Iterator<ValidateEvent> events = s.validate(msg);
            while (events.hasNext()) {
                ValidateEvent event = events.next();
                switch (event.getEventCase()) {
                    case NOTIFICATION -> dispatch(event.getNotification(), null);
                    case RESPONSE -> {
                        return WireConverter.fromWire(event.getResponse());
                    }
                    default -> log.debug("Ignoring empty Validate event from plugin {}", name);
                }
            }
            return null;
        });
        if (resp == null) {
            throw new RpcException("Validate returned no result");
        }
        return resp;
    }

    public StreamingClient streaming() {
        return streaming;
    }

    public boolean isClosed() {
        return closed.get() || channel.isShutdown();
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.shutdown();
        try {
            if (!channel.awaitTermination(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface Call<T> {
        T run(PluginServiceGrpc.PluginServiceBlockingStub stub);
    }

    /**
     * Runs {@code call} under a gRPC context that {@code ctx} cancels, with {@code ctx}'s remaining
     * time as deadline. The cancel listener is removed again when the call returns.
     */
    private <T> T invoke(CallContext ctx, String method, Call<T> call) throws RpcException {
        if (isClosed()) {
            throw new RpcException(Status.Code.UNAVAILABLE, "plugin " + name + " is closed", null);
        }
        if (ctx.isCancelled()) {
            throw new RpcException(Status.Code.CANCELLED, method + (ctx.isDeadlineExceeded() ? " timed out" : " cancelled"),
                    null);
        }
        PluginServiceGrpc.PluginServiceBlockingStub callStub = stub;
        Optional<Duration> remaining = ctx.remaining();
        if (remaining.isPresent()) {
            callStub = callStub.withDeadlineAfter(Math.max(1, remaining.get().toNanos()), TimeUnit.NANOSECONDS);
        }

        Context.CancellableContext grpcContext = Context.current().withCancellation();
        CallContext.Registration registration = ctx.onCancel(() -> grpcContext.cancel(null));
        Context previous = grpcContext.attach();
        try {
            return call.run(callStub);
        } catch (StatusRuntimeException e) {
            throw translate(ctx, method, e);
        } finally {
            grpcContext.detach(previous);
            registration.remove();
            grpcContext.cancel(null);
        }
    }

    private RpcException translate(CallContext ctx, String method, StatusRuntimeException e) {
        Status status = e.getStatus();
        String detail = status.getDescription() != null ? status.getDescription() : status.getCode().name();
        return switch (status.getCode()) {
            case DEADLINE_EXCEEDED -> new RpcException(status.getCode(), method + " timed out", e);
            case CANCELLED -> new RpcException(status.getCode(),
                    method + (ctx.isDeadlineExceeded() ? " timed out" : " cancelled"), e);
            case UNAVAILABLE -> new RpcException(status.getCode(), "plugin " + name + " unavailable: " + detail, e);
            default -> new RpcException(status.getCode(), method + " failed: " + detail, e);
        };
    }

    private void dispatch(NotificationMessage notification, ProgressCallback callback) {
        Object params;
        try {
            params = WireConverter.fromNotification(notification);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed {} notification from plugin {}: {}", notification.getMethod(), name,
                    e.getOriginalMessage());
            return;
        }
        if (params == null) {
            log.debug("Ignoring empty {} notification from plugin {}", notification.getMethod(), name);
            return;
        }
        if (callback != null && params instanceof Progress progress) {
            try {
                callback.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("Progress callback failed for token {}: {}", progress.token(), e.getMessage(), e);
            }
        }
        streaming.handleNotification(notification.getMethod(), params);
    }

    private String encodeConfig(Map<String, Object> config) throws RpcException {
        try {
            return WireConverter.encodeMap(config);
        } catch (JsonProcessingException e) {
            throw new RpcException("failed to encode config for plugin " + name + ": " + e.getOriginalMessage(), e);
        }
    }

    private static boolean awaitReady(ManagedChannel channel, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        ConnectivityState state = channel.getState(true);
        while (state != ConnectivityState.READY) {
            long left = deadline - System.nanoTime();
            if (state == ConnectivityState.SHUTDOWN || left <= 0) {
                return false;
            }
            CountDownLatch changed = new CountDownLatch(1);
            channel.notifyWhenStateChanged(state, changed::countDown);
            changed.await(left, TimeUnit.NANOSECONDS);
            state = channel.getState(true);
        }
        return true;
    }
}
