package com.relpilot.plugin;

import java.util.List;

/**
 * Plugin metadata returned once per plugin process by {@link Plugin#getInfo()}.
 *
 * @param name         plugin name (matches the configured plugin name)
 * @param version      plugin version
 * @param description  short description
 * @param author       plugin author
 * @param hooks        hooks the plugin supports; never null
 * @param configSchema optional JSON schema describing the accepted configuration map
 */
public record Info(
        String name,
        String version,
        String description,
        String author,
        List<Hook> hooks,
        String configSchema
) {
    private static final Info EMPTY = new Info("", "", "", "", List.of(), "");

    public Info {
        name = name != null ? name : "";
        version = version != null ? version : "";
        description = description != null ? description : "";
        author = author != null ? author : "";
        hooks = hooks != null ? List.copyOf(hooks) : List.of();
        configSchema = configSchema != null ? configSchema : "";
    }

    /** Zero value: what the host sees when capability discovery fails. */
    public static Info empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return name.isEmpty() && version.isEmpty() && hooks.isEmpty();
    }

    public boolean supports(Hook hook) {
        return hook != null && hooks.contains(hook);
    }
}
