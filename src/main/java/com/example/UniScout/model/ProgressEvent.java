package com.example.UniScout.model;

/**
 * A single progress step streamed to the client.
 *
 * step    - pipeline step, e.g. "validate-start", "search-complete", "done"
 * message - human-readable description of the step
 * data    - optional payload for UI, e.g.:
 *           - Map with backend id and result counts for search steps
 *           - OrchestrationOutcome for the final "done" step
 */
public record ProgressEvent(
        ProgressStep step,
        String message,
        Object data
) {
    public static ProgressEvent of(ProgressStep step, String message) {
        return new ProgressEvent(step, message, null);
    }
}
