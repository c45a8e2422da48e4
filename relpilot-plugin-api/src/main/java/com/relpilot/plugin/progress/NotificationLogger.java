package com.relpilot.plugin.progress;

import java.util.Map;

/**
 * Sends log lines to the host as {@code notifications/message}. Stateless and fire-and-forget.
 */
public interface NotificationLogger {

    void log(LogLevel level, String message, Map<String, Object> data);

    default void debug(String message) {
        log(LogLevel.DEBUG, message, null);
    }

    default void info(String message) {
        log(LogLevel.INFO, message, null);
    }

    default void warning(String message) {
        log(LogLevel.WARNING, message, null);
    }

    default void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    static NotificationLogger noop() {
        return (level, message, data) -> { };
    }
}
