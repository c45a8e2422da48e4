package com.relpilot.host;

import com.relpilot.config.HostConfig;
import com.relpilot.config.PluginConfig;
import com.relpilot.plugin.PluginException;

import java.nio.file.Path;

/** Default connector: locates the plugin binary in the allowed directories and spawns it. */
public final class ProcessPluginConnector implements PluginConnector {

    private final PluginBinaryLocator locator;
    private final PluginLauncher launcher;

    public ProcessPluginConnector(HostConfig config) {
        this(new PluginBinaryLocator(config.getPluginDirs()), new PluginLauncher(config));
    }

    public ProcessPluginConnector(PluginBinaryLocator locator, PluginLauncher launcher) {
        this.locator = locator;
        this.launcher = launcher;
    }

    @Override
    public PluginClient connect(PluginConfig config) throws PluginException {
        Path binary = locator.locate(config);
        return launcher.launch(config.getName(), binary);
    }
}
