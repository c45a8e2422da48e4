package com.relpilot.protocol.streaming;

import com.relpilot.plugin.progress.Progress;

/** Receives progress events on the thread that is waiting for the plugin call. */
@FunctionalInterface
public interface ProgressCallback {

    void onProgress(Progress progress);
}
