package com.relpilot.plugin;

import com.relpilot.plugin.progress.NotificationLogger;
import com.relpilot.plugin.progress.ProgressReporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallContextTest {

    @Test
    void background_hasNoDeadlineAndIsNotCancelled() {
        CallContext ctx = CallContext.background();
        assertFalse(ctx.isCancelled());
        assertTrue(ctx.remaining().isEmpty());
        assertSame(ProgressReporter.noop(), ctx.progress());
    }

    @Test
    void cancel_runsListenersOnceAndPropagatesToChildren() {
        CallContext parent = CallContext.background();
        CallContext child = parent.withTimeout(Duration.ofMinutes(5));
        AtomicInteger calls = new AtomicInteger();
        child.onCancel(calls::incrementAndGet);

        parent.cancel();
        parent.cancel();

        assertTrue(parent.isCancelled());
        assertTrue(child.isCancelled());
        assertEquals(1, calls.get());

        child.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get(), "listener registered after cancel runs immediately");
    }

    @Test
    void onCancel_removedRegistrationDoesNotRun() {
        CallContext ctx = CallContext.background();
        AtomicInteger calls = new AtomicInteger();
        CallContext.Registration registration = ctx.onCancel(calls::incrementAndGet);
        assertEquals(1, ctx.cancelListenerCount());

        registration.remove();
        ctx.cancel();

        assertEquals(0, ctx.cancelListenerCount());
        assertEquals(0, calls.get());
    }

    @Test
    void cancel_detachesChildFromParent() {
        CallContext parent = CallContext.background();
        for (int i = 0; i < 500; i++) {
            CallContext child = parent.withTimeout(Duration.ofMinutes(1));
            child.withStreaming(null, null);
            child.cancel();
        }
        assertEquals(0, parent.cancelListenerCount());

        CallContext live = parent.withTimeout(Duration.ofMinutes(1));
        assertEquals(1, parent.cancelListenerCount());
        parent.cancel();
        assertTrue(live.isCancelled());
        assertEquals(0, parent.cancelListenerCount());
    }

    @Test
    void cancel_childDoesNotCancelParent() {
        CallContext parent = CallContext.background();
        CallContext child = parent.withTimeout(Duration.ofMinutes(1));
        child.cancel();
        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
    }

    @Test
    void withTimeout_expiredDeadlineCountsAsCancelled() throws InterruptedException {
        CallContext ctx = CallContext.background().withTimeout(Duration.ofMillis(20));
        assertTrue(ctx.remaining().isPresent());
        Thread.sleep(60);
        assertTrue(ctx.isDeadlineExceeded());
        assertTrue(ctx.isCancelled());
        assertEquals(Duration.ZERO, ctx.remaining().get());
    }

    @Test
    void withTimeout_keepsEarlierParentDeadline() {
        CallContext shortCtx = CallContext.background().withTimeout(Duration.ofSeconds(1));
        CallContext longer = shortCtx.withTimeout(Duration.ofHours(1));
        assertTrue(longer.remaining().get().compareTo(Duration.ofSeconds(1)) <= 0);
    }

    @Test
    void withStreaming_replacesReporterAndLogger() {
        ProgressReporter reporter = ProgressReporter.noop();
        NotificationLogger logger = (level, message, data) -> { };
        CallContext ctx = CallContext.background().withStreaming(reporter, logger);
        assertSame(reporter, ctx.progress());
        assertSame(logger, ctx.logger());
    }
}
