package com.example.UniScout.service;

import com.example.UniScout.model.CitationRecord;
import com.example.UniScout.model.EvidenceBundle;
import com.example.UniScout.model.SearchResult;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CitationFormatter {

    static final int PREVIEW_LIMIT = 150;
    private static final String ELLIPSIS = "...";

    public List<CitationRecord> project(EvidenceBundle evidence) {
        return evidence.items().stream().map(this::project).toList();
    }

    public CitationRecord project(SearchResult result) {
        return new CitationRecord(result.title(), result.url(), preview(result.content()), result.relevanceScore());
    }

    static String preview(String content) {
        if (content == null) {
            return "";
        }
        String flat = content.strip().replaceAll("\\s+", " ");
        if (flat.length() <= PREVIEW_LIMIT) {
            return flat;
        }
        return flat.substring(0, PREVIEW_LIMIT - ELLIPSIS.length()) + ELLIPSIS;
    }
}
