package com.relpilot.protocol.streaming;

/** Method names of the notifications a plugin streams ahead of a call's response. */
public final class NotificationMethods {

    public static final String PROGRESS = "notifications/progress";
    public static final String MESSAGE = "notifications/message";

    private NotificationMethods() {
    }
}
