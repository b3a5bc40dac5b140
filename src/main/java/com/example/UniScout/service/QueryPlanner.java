package com.example.UniScout.service;

import com.example.UniScout.config.OrchestratorProperties;
import com.example.UniScout.model.AllowedDomainSet;
import com.example.UniScout.model.QueryPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns a question into backend search expressions.
 *
 * The raw question is passed through unless keyword extraction is switched on.
 * The restricted expression prefixes a {@code site:} token for the primary allowed domain.
 */
@Service
@RequiredArgsConstructor
public class QueryPlanner {

    static final String SITE_PREFIX = "site:";

    private final KeywordExtractor keywordExtractor;
    private final OrchestratorProperties properties;

    public QueryPlan plan(String query, AllowedDomainSet allowedDomains) {
        String expression = expression(query);
        String primary = allowedDomains == null ? null : allowedDomains.primary();
        String restricted = primary == null ? expression : SITE_PREFIX + primary + " " + expression;
        return new QueryPlan(restricted, expression);
    }

    private String expression(String query) {
        String trimmed = query.trim();
        if (!properties.keywordExtraction()) {
            return trimmed;
        }
        List<String> keywords = keywordExtractor.extract(trimmed);
        return keywords.isEmpty() ? trimmed : KeywordExtractor.quoted(keywords);
    }
}
