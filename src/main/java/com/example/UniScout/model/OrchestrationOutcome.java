package com.example.UniScout.model;

import java.util.List;

/**
 * Value returned to the caller of the orchestrator. Every failure mode is
 * represented here; the orchestrator never throws.
 */
public record OrchestrationOutcome(
        String answer,
        Sentinel sentinel,
        List<CitationRecord> citations,
        Diagnostics diagnostics
) {
    public OrchestrationOutcome {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
