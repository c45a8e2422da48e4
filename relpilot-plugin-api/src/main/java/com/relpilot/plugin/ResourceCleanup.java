package com.relpilot.plugin;

/**
 * Optional contract for plugins that hold resources (HTTP clients, temp directories, threads).
 * The plugin server calls {@link #onExit()} once when it shuts down, after the host connection
 * has closed.
 */
public interface ResourceCleanup {

    /**
     * Releases resources. Exceptions are logged by the server and not rethrown.
     */
    void onExit();
}
