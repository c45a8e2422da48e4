package com.relpilot.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.relpilot.plugin.CallContext;
import com.relpilot.plugin.ExecuteRequest;
import com.relpilot.plugin.ExecuteResponse;
import com.relpilot.plugin.Plugin;
import com.relpilot.plugin.ValidateResponse;
import com.relpilot.plugin.ValidationError;
import com.relpilot.protocol.streaming.StreamLogger;
import com.relpilot.protocol.streaming.StreamReporter;
import com.relpilot.protocol.wire.ExecuteEvent;
import com.relpilot.protocol.wire.ExecuteRequestMessage;
import com.relpilot.protocol.wire.ExecuteResponseMessage;
import com.relpilot.protocol.wire.GetInfoRequest;
import com.relpilot.protocol.wire.PluginInfoMessage;
import com.relpilot.protocol.wire.PluginServiceGrpc;
import com.relpilot.protocol.wire.ValidateEvent;
import com.relpilot.protocol.wire.ValidateRequestMessage;
import com.relpilot.protocol.wire.ValidateResponseMessage;
import com.relpilot.protocol.wire.WireConverter;
import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Plugin side of {@code PluginService}: decodes wire messages, calls the {@link Plugin}
 * implementation and encodes its answer. Anything the implementation throws, and any config it
 * cannot be given because the JSON does not parse, comes back as a failed response rather than
 * a gRPC error.
 * <p>
 * Each call runs under a {@link CallContext} that is cancelled when the host cancels the call or
 * its deadline passes.
 */
final class PluginGrpcService extends PluginServiceGrpc.PluginServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(PluginGrpcService.class);

    private final Plugin impl;
    private final StreamReporter reporter;
    private final String loggerName;

    PluginGrpcService(Plugin impl, String loggerName) {
        this.impl = impl;
        this.loggerName = loggerName;
        this.reporter = new StreamReporter((method, params) ->
                log.debug("Dropping {} reported outside a plugin call", method));
    }

    @Override
    public void getInfo(GetInfoRequest request, StreamObserver<PluginInfoMessage> observer) {
        PluginInfoMessage info;
        try {
            info = WireConverter.toWire(impl.getInfo());
        } catch (RuntimeException e) {
            log.warn("Plugin getInfo failed: {}", e.getMessage(), e);
            observer.onError(Status.INTERNAL.withDescription(describe(e)).withCause(e).asRuntimeException());
            return;
        }
        observer.onNext(info);
        observer.onCompleted();
    }

    @Override
    public void execute(ExecuteRequestMessage request, StreamObserver<ExecuteEvent> observer) {
        CallStream<ExecuteEvent> stream = new CallStream<>(observer,
                n -> ExecuteEvent.newBuilder().setNotification(n).build(), "Execute");
        ExecuteResponseMessage response = execute(request, stream);
        stream.complete(ExecuteEvent.newBuilder().setResponse(response).build());
    }

    @Override
    public void validate(ValidateRequestMessage request, StreamObserver<ValidateEvent> observer) {
        CallStream<ValidateEvent> stream = new CallStream<>(observer,
                n -> ValidateEvent.newBuilder().setNotification(n).build(), "Validate");
        ValidateResponseMessage response = WireConverter.toWire(validate(request, stream));
        stream.complete(ValidateEvent.newBuilder().setResponse(response).build());
    }

    ExecuteResponseMessage execute(ExecuteRequestMessage msg, CallStream<?> stream) {
        Map<String, Object> config;
        try {
            config = WireConverter.decodeMap(msg.getConfig());
        } catch (JsonProcessingException e) {
            return failure("invalid config JSON: " + e.getOriginalMessage());
        }
        ExecuteRequest request = new ExecuteRequest(WireConverter.fromWire(msg.getHook()), config,
                WireConverter.fromWire(msg.getContext()), msg.getDryRun());

        ExecuteResponse response;
        try (HostCall call = HostCall.current()) {
            response = impl.execute(call.context().withStreaming(reporter.forCall(stream),
                    new StreamLogger(stream, loggerName)), request);
        } catch (Exception e) {
            log.warn("Plugin execute failed for hook {}: {}", request.hook(), e.getMessage(), e);
            return failure(describe(e));
        }
        if (response == null) {
            return failure("plugin returned no response");
        }
        String outputs;
        try {
            outputs = response.getOutputs().isEmpty() ? "" : WireConverter.encodeMap(response.getOutputs());
        } catch (JsonProcessingException e) {
            return failure("failed to encode outputs: " + e.getOriginalMessage());
        }
        return ExecuteResponseMessage.newBuilder()
                .setSuccess(response.isSuccess())
                .setMessage(orEmpty(response.getMessage()))
                .setError(orEmpty(response.getError()))
                .setOutputs(outputs)
                .addAllArtifacts(WireConverter.toWireArtifacts(response.getArtifacts()))
                .build();
    }

    ValidateResponse validate(ValidateRequestMessage msg, CallStream<?> stream) {
        Map<String, Object> config;
        try {
            config = WireConverter.decodeMap(msg.getConfig());
        } catch (JsonProcessingException e) {
            return ValidateResponse.invalid("config", "invalid JSON: " + e.getOriginalMessage());
        }
        try (HostCall call = HostCall.current()) {
            return impl.validate(call.context().withStreaming(reporter.forCall(stream),
                    new StreamLogger(stream, loggerName)), config);
        } catch (Exception e) {
            log.warn("Plugin validate failed: {}", e.getMessage(), e);
            return new ValidateResponse(false, List.of(new ValidationError("", describe(e), "internal")));
        }
    }

    private static ExecuteResponseMessage failure(String error) {
        return ExecuteResponseMessage.newBuilder().setSuccess(false).setError(error).build();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String orEmpty(String s) {
        return s != null ? s : "";
    }

    /**
     * Binds a {@link CallContext} to the gRPC context of the call being served: host cancellation
     * and the call's deadline cancel it. Closing detaches the binding and cancels the context.
     */
    private static final class HostCall implements AutoCloseable {

        private final Context grpcContext;
        private final Context.CancellationListener listener;
        private final CallContext root;
        private final CallContext context;

        private HostCall(Context grpcContext) {
            this.grpcContext = grpcContext;
            this.root = CallContext.background();
            this.listener = c -> root.cancel();
            Deadline deadline = grpcContext.getDeadline();
            this.context = deadline == null ? root
                    : root.withTimeout(Duration.ofNanos(Math.max(0, deadline.timeRemaining(TimeUnit.NANOSECONDS))));
            grpcContext.addListener(listener, Runnable::run);
        }

        static HostCall current() {
            return new HostCall(Context.current());
        }

        CallContext context() {
            return context;
        }

        @Override
        public void close() {
            grpcContext.removeListener(listener);
            root.cancel();
        }
    }
}
