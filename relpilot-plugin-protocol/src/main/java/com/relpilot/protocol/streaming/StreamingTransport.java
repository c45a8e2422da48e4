package com.relpilot.protocol.streaming;

/** Outbound side of a plugin call that notifications can be written to. */
@FunctionalInterface
public interface StreamingTransport {

    /**
     * Queues a notification for the host without waiting for the network. Notifications written
     * after the call finished are dropped.
     *
     * @param params a {@link com.relpilot.plugin.progress.Progress} or
     *               {@link com.relpilot.plugin.progress.LogNotification}
     */
    void writeNotificationAsync(String method, Object params);
}
