package com.example.UniScout.model;

import java.util.List;

/**
 * What happened during one orchestration call.
 *
 * @param backends       one report per known backend, in search order
 * @param totalRaw       sum of raw result counts
 * @param totalSurviving sum of results that entered the merge
 * @param evidenceSize   size of the merged evidence bundle
 * @param degraded       true when at least one enabled backend errored or was skipped
 * @param finalState     last state reached ({@code DONE} unless the call was aborted)
 */
public record Diagnostics(
        List<BackendReport> backends,
        int totalRaw,
        int totalSurviving,
        int evidenceSize,
        boolean degraded,
        OrchestrationState finalState
) {
    public Diagnostics {
        backends = backends == null ? List.of() : List.copyOf(backends);
    }

    public static Diagnostics of(List<BackendReport> reports, int evidenceSize, OrchestrationState finalState) {
        int raw = reports.stream().mapToInt(BackendReport::rawCount).sum();
        int surviving = reports.stream().mapToInt(BackendReport::survivingCount).sum();
        boolean degraded = reports.stream().anyMatch(BackendReport::isFailure);
        return new Diagnostics(reports, raw, surviving, evidenceSize, degraded, finalState);
    }

    public static Diagnostics none(OrchestrationState finalState) {
        return new Diagnostics(List.of(), 0, 0, 0, false, finalState);
    }

    public BackendReport report(BackendId backend) {
        return backends.stream()
                .filter(r -> r.backend() == backend)
                .findFirst()
                .orElse(null);
    }
}
