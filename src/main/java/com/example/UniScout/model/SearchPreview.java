package com.example.UniScout.model;

import java.util.List;

/**
 * Retrieval-only result, no synthesis:
 * - query: original user question
 * - citations: merged evidence projected for display
 * - diagnostics: per-backend status and counts
 */
public record SearchPreview(
        String query,
        List<CitationRecord> citations,
        Diagnostics diagnostics
) {}
