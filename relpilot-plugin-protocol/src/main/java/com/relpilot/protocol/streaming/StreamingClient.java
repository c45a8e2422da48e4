package com.relpilot.protocol.streaming;

import com.relpilot.plugin.progress.LogNotification;
import com.relpilot.plugin.progress.Progress;
import com.relpilot.plugin.progress.ProgressKind;
import com.relpilot.plugin.progress.ProgressToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Host-side receiver of a plugin's notifications. Progress events are routed to the callback
 * registered for their token; log lines are written to the plugin's SLF4J logger and passed to
 * log listeners. Token callbacks are removed when their {@code end} event has been dispatched.
 */
public final class StreamingClient {

    private static final Logger log = LoggerFactory.getLogger(StreamingClient.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<ProgressToken, ProgressCallback> callbacks = new HashMap<>();
    private final List<Consumer<LogNotification>> logListeners = new CopyOnWriteArrayList<>();
    private final Logger pluginLog;

    /** @param pluginName used for the {@code relpilot.plugin.<name>} logger */
    public StreamingClient(String pluginName) {
        this.pluginLog = LoggerFactory.getLogger("relpilot.plugin." + pluginName);
    }

    public void onProgress(ProgressToken token, ProgressCallback callback) {
        lock.writeLock().lock();
        try {
            callbacks.put(token, callback);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeProgressCallback(ProgressToken token) {
        lock.writeLock().lock();
        try {
            callbacks.remove(token);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addLogListener(Consumer<LogNotification> listener) {
        logListeners.add(listener);
    }

    public void removeLogListener(Consumer<LogNotification> listener) {
        logListeners.remove(listener);
    }

    public int callbackCount() {
        lock.readLock().lock();
        try {
            return callbacks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Dispatches decoded params of a {@code notifications/*} message; anything else is ignored. */
    public void handleNotification(String method, Object params) {
        if (NotificationMethods.PROGRESS.equals(method) && params instanceof Progress progress) {
            handleProgress(progress);
        } else if (NotificationMethods.MESSAGE.equals(method) && params instanceof LogNotification n) {
            handleLog(n);
        } else {
            log.debug("Ignoring notification {}", method);
        }
    }

    private void handleProgress(Progress progress) {
        ProgressCallback callback;
        lock.readLock().lock();
        try {
            callback = callbacks.get(progress.token());
        } finally {
            lock.readLock().unlock();
        }
        if (callback == null) {
            return;
        }
        try {
            callback.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed for token {}: {}", progress.token(), e.getMessage(), e);
        }
        if (progress.value().kind() == ProgressKind.END) {
            removeProgressCallback(progress.token());
        }
    }

    private void handleLog(LogNotification n) {
        switch (n.level()) {
            case DEBUG -> pluginLog.debug("{}", n.message());
            case WARNING -> pluginLog.warn("{}", n.message());
            case ERROR -> pluginLog.error("{}", n.message());
            default -> pluginLog.info("{}", n.message());
        }
        for (Consumer<LogNotification> listener : logListeners) {
            try {
                listener.accept(n);
            } catch (RuntimeException e) {
                log.warn("Log listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
