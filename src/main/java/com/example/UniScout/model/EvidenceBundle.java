package com.example.UniScout.model;

import java.util.List;

/**
 * Ranked, size-bounded results that form the only grounding material
 * handed to the synthesizer.
 */
public record EvidenceBundle(List<SearchResult> items) {

    public EvidenceBundle {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static EvidenceBundle empty() {
        return new EvidenceBundle(List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }
}
