package com.example.UniScout.service;

import com.example.UniScout.config.OrchestratorProperties;
import com.example.UniScout.model.EvidenceBundle;
import com.example.UniScout.model.SearchResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines result lists into one evidence bundle:
 * 1. concatenate in input order
 * 2. de-duplicate by url, first occurrence wins
 * 3. stable sort by score, highest first
 * 4. truncate to the cap
 */
@Component
public class ResultMerger {

    private final int defaultCap;

    @Autowired
    public ResultMerger(OrchestratorProperties properties) {
        this(properties.evidenceCap());
    }

    public ResultMerger(int defaultCap) {
        if (defaultCap < 1) {
            throw new IllegalArgumentException("evidence cap must be positive: " + defaultCap);
        }
        this.defaultCap = defaultCap;
    }

    public EvidenceBundle merge(List<List<SearchResult>> resultSets) {
        return merge(resultSets, defaultCap);
    }

    public EvidenceBundle merge(List<List<SearchResult>> resultSets, int cap) {
        Map<String, SearchResult> byUrl = new LinkedHashMap<>();
        for (List<SearchResult> set : resultSets) {
            if (set == null) {
                continue;
            }
            for (SearchResult result : set) {
                if (result != null && result.url() != null) {
                    byUrl.putIfAbsent(result.url(), result);
                }
            }
        }

        List<SearchResult> ranked = new ArrayList<>(byUrl.values());
        // List.sort is stable, so equal scores keep their input order
        ranked.sort(Comparator.comparingDouble(SearchResult::relevanceScore).reversed());
        return new EvidenceBundle(ranked.subList(0, Math.min(Math.max(cap, 0), ranked.size())));
    }
}
