package com.relpilot.protocol.streaming;

import com.relpilot.plugin.progress.LogLevel;
import com.relpilot.plugin.progress.LogNotification;
import com.relpilot.plugin.progress.NotificationLogger;

import java.util.Map;

/**
 * Plugin-side {@link NotificationLogger} that sends {@code notifications/message} on one call's
 * stream. Holds no state besides the logger name.
 */
public final class StreamLogger implements NotificationLogger {

    private final StreamingTransport transport;
    private final String loggerName;

    public StreamLogger(StreamingTransport transport, String loggerName) {
        this.transport = transport;
        this.loggerName = loggerName;
    }

    @Override
    public void log(LogLevel level, String message, Map<String, Object> data) {
        transport.writeNotificationAsync(NotificationMethods.MESSAGE, new LogNotification(level, message, loggerName, data));
    }
}
