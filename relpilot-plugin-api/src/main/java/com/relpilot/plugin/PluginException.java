package com.relpilot.plugin;

/**
 * Checked exception for failures talking to a plugin: connection lost, serialization failure,
 * timeout or cancellation of the call. Business failures are never reported this way.
 */
public class PluginException extends Exception {

    public PluginException(String message) {
        super(message);
    }

    public PluginException(String message, Throwable cause) {
        super(message, cause);
    }
}
