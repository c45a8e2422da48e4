package com.relpilot.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.relpilot.protocol.wire.ProtocolJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Writes plugin lifecycle events as single-line JSON on the {@value #LOGGER_NAME} logger, so
 * they can be routed to their own appender. An optional sink receives every event as well.
 */
public final class PluginAuditLog {

    public static final String LOGGER_NAME = "relpilot.plugin.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger log = LoggerFactory.getLogger(PluginAuditLog.class);

    private final Consumer<AuditEvent> sink;

    public PluginAuditLog() {
        this(null);
    }

    public PluginAuditLog(Consumer<AuditEvent> sink) {
        this.sink = sink;
    }

    public void logLoad(String pluginName, boolean success, String error) {
        record(AuditEvent.now(pluginName, null, AuditEvent.Type.LOAD, success, 0, error));
    }

    public void logUnload(String pluginName) {
        record(AuditEvent.now(pluginName, null, AuditEvent.Type.UNLOAD, true, 0, null));
    }

    public void logExecution(String pluginName, String hook, boolean success, Duration duration, String error) {
        record(AuditEvent.now(pluginName, hook, AuditEvent.Type.EXECUTE, success, duration.toMillis(), error));
    }

    public void logTimeout(String pluginName, String hook, Duration duration) {
        record(AuditEvent.now(pluginName, hook, AuditEvent.Type.TIMEOUT, false, duration.toMillis(),
                "execution timed out after " + duration.toMillis() + "ms"));
    }

    private void record(AuditEvent event) {
        if (audit.isInfoEnabled()) {
            try {
                audit.info(ProtocolJson.MAPPER.writeValueAsString(event));
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize audit event for plugin {}: {}", event.pluginName(), e.getMessage());
            }
        }
        if (sink != null) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                log.warn("Audit sink failed for plugin {}: {}", event.pluginName(), e.getMessage(), e);
            }
        }
    }
}
