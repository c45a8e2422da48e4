package com.relpilot.plugin.progress;

/**
 * Reports progress of a long-running operation back to the host. Obtained from
 * {@link com.relpilot.plugin.CallContext#progress()}; sends are fire-and-forget and never block.
 */
public interface ProgressReporter {

    /**
     * Opens a session and emits a {@code begin} event at 0%.
     *
     * @param total   number of steps; 0 means unknown, every report is then at 0%
     * @param message title of the session
     */
    ProgressToken start(int total, String message);

    /** Emits a {@code report} event. Unknown or completed tokens are ignored. */
    void update(ProgressToken token, int current, String message);

    /** Closes the session and emits an {@code end} event at 100%, also for a token that is no longer open. */
    void complete(ProgressToken token, String message);

    /** Reporter that discards everything; used when no streaming channel is attached. */
    static ProgressReporter noop() {
        return NoopReporter.INSTANCE;
    }

    final class NoopReporter implements ProgressReporter {
        private static final NoopReporter INSTANCE = new NoopReporter();
        private static final ProgressToken TOKEN = ProgressToken.of("noop");

        private NoopReporter() {
        }

        @Override
        public ProgressToken start(int total, String message) {
            return TOKEN;
        }

        @Override
        public void update(ProgressToken token, int current, String message) {
        }

        @Override
        public void complete(ProgressToken token, String message) {
        }
    }
}
