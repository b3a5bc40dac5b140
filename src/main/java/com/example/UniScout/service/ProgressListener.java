package com.example.UniScout.service;

import com.example.UniScout.model.ProgressEvent;

/**
 * Receives progress events from an orchestration call. Delivery is fire-and-forget;
 * the orchestrator ignores listener failures.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = event -> { };

    void onProgress(ProgressEvent event);

    static ProgressListener noop() {
        return NOOP;
    }
}
