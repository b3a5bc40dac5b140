package com.example.UniScout.model;

/**
 * Identifies a search backend. Declaration order is the order in which
 * backends are searched and in which their sections appear in a composed answer.
 */
public enum BackendId {

    /** pgvector-backed semantic corpus of curated documents. */
    KNOWLEDGE_BASE("Knowledge Base Results", "knowledge base"),

    /** Tavily web search, scoped to the allowed domains. */
    TAVILY("Policy Documents", "policy documents"),

    /** Serper (Google SERP) web search, scoped to the allowed domains. */
    SERPER("Web Search Results", "web search");

    private final String sectionHeader;
    private final String label;

    BackendId(String sectionHeader, String label) {
        this.sectionHeader = sectionHeader;
        this.label = label;
    }

    public String sectionHeader() {
        return sectionHeader;
    }

    public String label() {
        return label;
    }
}
