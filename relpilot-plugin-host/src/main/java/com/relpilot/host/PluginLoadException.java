package com.relpilot.host;

import com.relpilot.plugin.PluginException;

/**
 * A configured plugin could not be located, started, connected or validated.
 */
public class PluginLoadException extends PluginException {

    private final String pluginName;

    public PluginLoadException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginLoadException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
