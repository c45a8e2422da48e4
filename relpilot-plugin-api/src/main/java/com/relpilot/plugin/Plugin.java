package com.relpilot.plugin;

import java.util.Map;

/**
 * Contract every relpilot plugin implements. The host calls {@link #getInfo()} once per plugin
 * process, then {@link #validate} with the plugin's configuration, then {@link #execute} for each
 * hook the plugin declared support for.
 * <p>
 * Domain failures are returned as data ({@link ExecuteResponse#failure(String)},
 * {@link ValidateResponse} errors). {@link PluginException} is reserved for the transport.
 */
public interface Plugin {

    /** Plugin metadata. Must be cheap and side-effect free. */
    Info getInfo();

    /**
     * Runs the plugin for one hook.
     *
     * @param ctx     call context; implementations should check {@link CallContext#isCancelled()}
     *                between long-running steps and report progress through {@link CallContext#progress()}
     * @param request hook, configuration, release context and dry-run flag
     * @return self-contained response; never null
     * @throws PluginException when the call could not be delivered or answered
     */
    ExecuteResponse execute(CallContext ctx, ExecuteRequest request) throws PluginException;

    /**
     * Checks the plugin configuration without side effects.
     *
     * @throws PluginException when the call could not be delivered or answered
     */
    ValidateResponse validate(CallContext ctx, Map<String, Object> config) throws PluginException;
}
