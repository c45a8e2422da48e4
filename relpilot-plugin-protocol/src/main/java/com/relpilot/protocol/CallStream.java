package com.relpilot.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.relpilot.protocol.streaming.StreamingTransport;
import com.relpilot.protocol.wire.NotificationMessage;
import com.relpilot.protocol.wire.WireConverter;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Response stream of one server-streaming plugin call. Notifications and the final response go
 * through the same observer in write order, so the host sees every notification of the call
 * before its response. Writes after {@link #complete} or after the host cancelled are dropped.
 *
 * @param <E> event message of the call
 */
final class CallStream<E> implements StreamingTransport {

    private static final Logger log = LoggerFactory.getLogger(CallStream.class);

    private final StreamObserver<E> observer;
    private final Function<NotificationMessage, E> toEvent;
    private final String method;
    private boolean done;

    CallStream(StreamObserver<E> observer, Function<NotificationMessage, E> toEvent, String method) {
        this.observer = observer;
        this.toEvent = toEvent;
        this.method = method;
        if (observer instanceof ServerCallStreamObserver<E> serverObserver) {
            serverObserver.setOnCancelHandler(this::cancelled);
        }
    }

    @Override
    public void writeNotificationAsync(String notificationMethod, Object params) {
        NotificationMessage notification;
        try {
            notification = WireConverter.toNotification(notificationMethod, params);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping {} notification of {}: {}", notificationMethod, method, e.getMessage());
            return;
        }
        write(toEvent.apply(notification));
    }

    /** Sends the call's response and closes the stream. */
    synchronized void complete(E response) {
        if (done) {
            log.debug("Response of {} dropped, the call already ended", method);
            return;
        }
        try {
            observer.onNext(response);
            observer.onCompleted();
        } catch (RuntimeException e) {
            log.debug("Response of {} not delivered: {}", method, e.getMessage());
        } finally {
            done = true;
        }
    }

    private synchronized void write(E event) {
        if (done) {
            return;
        }
        try {
            observer.onNext(event);
        } catch (RuntimeException e) {
            done = true;
            log.debug("Stream of {} closed while writing: {}", method, e.getMessage());
        }
    }

    private synchronized void cancelled() {
        done = true;
        log.debug("Host cancelled {}", method);
    }
}
