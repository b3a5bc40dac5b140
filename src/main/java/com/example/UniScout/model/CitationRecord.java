package com.example.UniScout.model;

/**
 * UI-safe projection of a {@link SearchResult}.
 */
public record CitationRecord(
        String title,
        String url,
        String contentPreview,
        double score
) {
}
