package com.relpilot.plugin;

import com.relpilot.plugin.progress.NotificationLogger;
import com.relpilot.plugin.progress.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-call context threaded from the host through the RPC layer into the plugin implementation.
 * Carries an optional deadline, a cooperative cancellation flag and, on the plugin side, the
 * streaming progress reporter and logger for the call.
 * <p>
 * Child contexts ({@link #withTimeout}, {@link #withStreaming}) are cancelled when their parent is.
 * A child stays registered with its parent until it is cancelled, so callers that derive a child
 * for one call cancel it when the call is done.
 * Cancellation never interrupts threads; implementations poll {@link #isCancelled()} or register
 * {@link #onCancel(Runnable)}.
 */
public final class CallContext {

    private static final Logger log = LoggerFactory.getLogger(CallContext.class);
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final CallContext parent;
    private final long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
    private final ProgressReporter progress;
    private final NotificationLogger logger;
    private final Registration parentRegistration;

    /** Handle on a listener added with {@link #onCancel(Runnable)}. */
    @FunctionalInterface
    public interface Registration {

        /** Detaches the listener. Has no effect once the context was cancelled. */
        void remove();
    }

    private CallContext(CallContext parent, long deadlineNanos, ProgressReporter progress, NotificationLogger logger) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
        this.progress = progress;
        this.logger = logger;
        this.parentRegistration = parent != null ? parent.onCancel(this::cancel) : null;
    }

    /** Root context: no deadline, never cancelled unless {@link #cancel()} is called. */
    public static CallContext background() {
        return new CallContext(null, NO_DEADLINE, ProgressReporter.noop(), NotificationLogger.noop());
    }

    /** Child whose deadline is the earlier of this context's and now + {@code timeout}. */
    public CallContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long candidate = saturatedAdd(System.nanoTime(), timeout.toNanos());
        long deadline = deadlineNanos == NO_DEADLINE ? candidate : Math.min(deadlineNanos, candidate);
        return new CallContext(this, deadline, progress, logger);
    }

    /** Child that reports progress and logs through the given channel. */
    public CallContext withStreaming(ProgressReporter progress, NotificationLogger logger) {
        return new CallContext(this, deadlineNanos,
                progress != null ? progress : ProgressReporter.noop(),
                logger != null ? logger : NotificationLogger.noop());
    }

    /**
     * Cancels this context and its children and detaches it from its parent. Listeners run once,
     * on the calling thread. Calling again has no effect.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        if (parentRegistration != null) {
            parentRegistration.remove();
        }
        for (Runnable listener : cancelListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancel listener failed: {}", e.getMessage(), e);
            }
        }
        cancelListeners.clear();
    }

    /** True after {@link #cancel()} on this context or an ancestor, or once the deadline has passed. */
    public boolean isCancelled() {
        if (cancelled.get()) return true;
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) return true;
        return parent != null && parent.isCancelled();
    }

    /** True once the deadline has passed, whether or not {@link #cancel()} was called. */
    public boolean isDeadlineExceeded() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
    }

    /** Time left before the deadline, or empty when the context has none. Never negative. */
    public Optional<Duration> remaining() {
        if (deadlineNanos == NO_DEADLINE) return Optional.empty();
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(Duration.ofNanos(Math.max(0L, left)));
    }

    /**
     * Runs {@code listener} when the context is cancelled; immediately if it already is.
     * Remove the returned registration once the listener is no longer needed.
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        if (cancelled.get()) {
            listener.run();
            return () -> { };
        }
        cancelListeners.add(listener);
        if (cancelled.get() && cancelListeners.remove(listener)) {
            listener.run();
            return () -> { };
        }
        return () -> cancelListeners.remove(listener);
    }

    /** Listeners and child contexts currently waiting for this context to be cancelled. */
    public int cancelListenerCount() {
        return cancelListeners.size();
    }

    public ProgressReporter progress() {
        return progress;
    }

    public NotificationLogger logger() {
        return logger;
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return NO_DEADLINE - 1;
        }
        return r;
    }
}
