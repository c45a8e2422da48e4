package com.relpilot.protocol;

/**
 * Handle on a plugin server started by {@link PluginServer#serveTest}. The server is already
 * listening when this object is returned.
 */
public final class TestServer implements AutoCloseable {

    private final ReattachConfig reattachConfig;
    private final Runnable closeAction;

    TestServer(ReattachConfig reattachConfig, Runnable closeAction) {
        this.reattachConfig = reattachConfig;
        this.closeAction = closeAction;
    }

    /** Descriptor to attach a client with, e.g. {@link PluginRpcClient#connect(ReattachConfig)}. */
    public ReattachConfig reattachConfig() {
        return reattachConfig;
    }

    /** Stops accepting, closes open connections and waits for the server thread to finish. */
    @Override
    public void close() {
        closeAction.run();
    }
}
