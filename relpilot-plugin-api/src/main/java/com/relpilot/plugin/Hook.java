package com.relpilot.plugin;

import java.util.List;

/**
 * Point in the release workflow at which plugins can execute. The string values are part of the
 * wire contract and must not change. Declaration order is the canonical execution order: each
 * {@code pre-*} stage precedes its {@code post-*} counterpart, and the two terminal stages come last.
 */
public enum Hook {
    PRE_INIT("pre-init"),
    POST_INIT("post-init"),
    PRE_PLAN("pre-plan"),
    POST_PLAN("post-plan"),
    PRE_VERSION("pre-version"),
    POST_VERSION("post-version"),
    PRE_NOTES("pre-notes"),
    POST_NOTES("post-notes"),
    PRE_APPROVE("pre-approve"),
    POST_APPROVE("post-approve"),
    PRE_PUBLISH("pre-publish"),
    POST_PUBLISH("post-publish"),
    ON_SUCCESS("on-success"),
    ON_ERROR("on-error");

    private static final List<Hook> ALL = List.of(values());

    private final String value;

    Hook(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** All hooks in execution order. */
    public static List<Hook> all() {
        return ALL;
    }

    /**
     * Resolves a hook from its wire string (e.g. "pre-publish").
     *
     * @return the hook, or null when the value is null or not a known hook
     */
    public static Hook fromValue(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (Hook hook : ALL) {
            if (hook.value.equals(v)) {
                return hook;
            }
        }
        return null;
    }

    public boolean isPre() {
        return value.startsWith("pre-");
    }

    public boolean isPost() {
        return value.startsWith("post-");
    }

    /**
     * The paired stage: {@code pre-X} for {@code post-X} and the reverse. Terminal stages have no pair.
     *
     * @return counterpart hook, or null for {@link #ON_SUCCESS} and {@link #ON_ERROR}
     */
    public Hook counterpart() {
        if (isPre()) return fromValue("post-" + value.substring(4));
        if (isPost()) return fromValue("pre-" + value.substring(5));
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
