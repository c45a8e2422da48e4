package com.relpilot.plugin.config;

/** Mention syntax of a messaging platform. */
public enum MentionFormat {
    /** {@code @username}. */
    PLAIN,
    /** {@code <@USER_ID>}, {@code <!channel>}. */
    SLACK,
    /** {@code <@USER_ID>}, {@code <@&ROLE_ID>}, {@code <#CHANNEL_ID>}, {@code @everyone}, {@code @here}. */
    DISCORD
}
