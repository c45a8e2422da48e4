package com.relpilot.protocol.streaming;

import com.relpilot.plugin.progress.Progress;
import com.relpilot.plugin.progress.ProgressReporter;
import com.relpilot.plugin.progress.ProgressToken;
import com.relpilot.plugin.progress.ProgressValue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Plugin-side {@link ProgressReporter} that emits {@code notifications/progress} over a
 * {@link StreamingTransport}. Session state lives in a token map guarded by a lock; tokens are
 * {@code yyyyMMddHHmmss-<counter>}, unique within the process and unlikely to repeat across
 * restarts.
 * <p>
 * {@link #forCall} gives each plugin call a reporter that writes to that call's stream while the
 * token map stays shared.
 */
public final class StreamReporter implements ProgressReporter {

    private static final DateTimeFormatter TOKEN_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final StreamingTransport transport;
    private final Sessions sessions;

    public StreamReporter(StreamingTransport transport) {
        this(transport, new Sessions(Clock.systemDefaultZone()));
    }

    StreamReporter(StreamingTransport transport, Clock clock) {
        this(transport, new Sessions(clock));
    }

    private StreamReporter(StreamingTransport transport, Sessions sessions) {
        this.transport = transport;
        this.sessions = sessions;
    }

    /** Reporter sharing this one's sessions that writes to {@code callTransport}. */
    public StreamReporter forCall(StreamingTransport callTransport) {
        return new StreamReporter(callTransport, sessions);
    }

    @Override
    public ProgressToken start(int total, String message) {
        ProgressToken token = sessions.open(total);
        emit(token, ProgressValue.begin(message, message), total);
        return token;
    }

    @Override
    public void update(ProgressToken token, int current, String message) {
        Session snapshot = sessions.advance(token, current);
        if (snapshot == null) {
            return;
        }
        emit(token, ProgressValue.report(message, percentage(current, snapshot.total)), snapshot.total);
    }

    /** Emits {@code end} even when {@code token} was never started or already completed. */
    @Override
    public void complete(ProgressToken token, String message) {
        if (token == null) {
            return;
        }
        Session removed = sessions.close(token);
        emit(token, ProgressValue.end(message), removed != null ? removed.total : 0);
    }

    /** Number of sessions started and not yet completed. */
    public int activeSessions() {
        return sessions.size();
    }

    /** Whether {@code token} is between start and complete. */
    public boolean isActive(ProgressToken token) {
        return sessions.contains(token);
    }

    static double percentage(int current, int total) {
        if (total <= 0) return 0;
        return (double) current / total * 100;
    }

    private void emit(ProgressToken token, ProgressValue value, int total) {
        transport.writeNotificationAsync(NotificationMethods.PROGRESS, new Progress(token, value, total));
    }

    private static final class Session {
        final int total;
        int current;
        final Instant started;

        Session(int total, Instant started) {
            this.total = total;
            this.started = started;
        }
    }

    private static final class Sessions {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<ProgressToken, Session> byToken = new HashMap<>();
        private final AtomicLong counter = new AtomicLong();
        private final Clock clock;

        Sessions(Clock clock) {
            this.clock = clock;
        }

        ProgressToken open(int total) {
            ProgressToken token = ProgressToken.of(
                    LocalDateTime.now(clock).format(TOKEN_TIME) + "-" + counter.incrementAndGet());
            lock.lock();
            try {
                byToken.put(token, new Session(total, clock.instant()));
            } finally {
                lock.unlock();
            }
            return token;
        }

        Session advance(ProgressToken token, int current) {
            if (token == null) return null;
            lock.lock();
            try {
                Session s = byToken.get(token);
                if (s != null) {
                    s.current = current;
                }
                return s;
            } finally {
                lock.unlock();
            }
        }

        Session close(ProgressToken token) {
            if (token == null) return null;
            lock.lock();
            try {
                return byToken.remove(token);
            } finally {
                lock.unlock();
            }
        }

        boolean contains(ProgressToken token) {
            lock.lock();
            try {
                return byToken.containsKey(token);
            } finally {
                lock.unlock();
            }
        }

        int size() {
            lock.lock();
            try {
                return byToken.size();
            } finally {
                lock.unlock();
            }
        }
    }
}
