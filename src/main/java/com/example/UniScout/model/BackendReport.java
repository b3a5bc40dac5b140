package com.example.UniScout.model;

/**
 * Per-backend diagnostics for one orchestration call.
 *
 * @param backend         backend id
 * @param status          final status
 * @param rawCount        results returned by the backend before filtering
 * @param survivingCount  results handed to the merger
 * @param restrictedCount results returned by the site-restricted query (domain-scoped backends)
 * @param filteredOut     unrestricted results rejected by the domain filter
 * @param detail          short human-readable detail, e.g. the error summary
 */
public record BackendReport(
        BackendId backend,
        BackendStatus status,
        int rawCount,
        int survivingCount,
        int restrictedCount,
        int filteredOut,
        String detail
) {
    public static BackendReport skipped(BackendId backend, String detail) {
        return new BackendReport(backend, BackendStatus.SKIPPED, 0, 0, 0, 0, detail);
    }

    public static BackendReport error(BackendId backend, String detail) {
        return new BackendReport(backend, BackendStatus.ERROR, 0, 0, 0, 0, detail);
    }

    public boolean isFailure() {
        return status == BackendStatus.ERROR || status == BackendStatus.SKIPPED;
    }
}
