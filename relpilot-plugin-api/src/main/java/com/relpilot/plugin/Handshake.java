package com.relpilot.plugin;

import java.util.Map;

/**
 * Handshake constants shared by the host and every plugin binary.
 * <p>
 * The host launches a plugin with {@link #MAGIC_COOKIE_KEY}={@link #MAGIC_COOKIE_VALUE} in its
 * environment. A binary started without it is not running as a plugin and must not serve.
 */
public final class Handshake {

    public static final String MAGIC_COOKIE_KEY = "RELPILOT_PLUGIN_MAGIC_COOKIE";
    public static final String MAGIC_COOKIE_VALUE = "relpilot-plugin-a3f91c7e";

    /** Environment variable through which the host advertises the app protocol versions it accepts. */
    public static final String PROTOCOL_VERSIONS_KEY = "RELPILOT_PLUGIN_PROTOCOL_VERSIONS";

    /** Application protocol version: the plugin.* RPC contract. */
    public static final int PROTOCOL_VERSION = 1;

    /** Core protocol version: the handshake line format itself. */
    public static final int CORE_PROTOCOL_VERSION = 1;

    private Handshake() {
    }

    /** True iff the current process was launched by a relpilot host. */
    public static boolean isPlugin() {
        return isPlugin(System.getenv());
    }

    /** True iff {@code env} carries the magic cookie with exactly the expected value. */
    public static boolean isPlugin(Map<String, String> env) {
        if (env == null) return false;
        return MAGIC_COOKIE_VALUE.equals(env.get(MAGIC_COOKIE_KEY));
    }
}
