package com.example.UniScout.model;

/**
 * A single ranked hit, normalized from whatever shape the backend returns.
 *
 * @param title          document title, never null
 * @param url            identity key used for de-duplication
 * @param content        snippet or full text handed to the synthesizer
 * @param relevanceScore backend score, 0 when the backend has none
 * @param sourceBackend  backend that produced the hit
 */
public record SearchResult(
        String title,
        String url,
        String content,
        double relevanceScore,
        BackendId sourceBackend
) {
    public SearchResult {
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }

    public static SearchResult of(String title, String url, String content, Double score, BackendId backend) {
        return new SearchResult(title, url, content, score == null ? 0.0 : score, backend);
    }
}
