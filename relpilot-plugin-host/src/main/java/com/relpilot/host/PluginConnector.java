package com.relpilot.host;

import com.relpilot.config.PluginConfig;
import com.relpilot.plugin.PluginException;

/**
 * Produces a connected {@link PluginClient} for a plugin configuration.
 */
@FunctionalInterface
public interface PluginConnector {

    PluginClient connect(PluginConfig config) throws PluginException;
}
