package com.relpilot.protocol;

/**
 * The plugin server could not start, typically because the listening socket could not be bound.
 */
public class PluginServeException extends RuntimeException {

    public PluginServeException(String message, Throwable cause) {
        super(message, cause);
    }
}
