package com.relpilot.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of {@link Plugin#execute}: the hook being fired, the plugin's free-form configuration,
 * the release context and the dry-run flag.
 */
public record ExecuteRequest(
        Hook hook,
        Map<String, Object> config,
        ReleaseContext context,
        boolean dryRun
) {
    public ExecuteRequest {
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        context = context != null ? context : ReleaseContext.empty();
    }
}
