package com.example.UniScout.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressStep {
    VALIDATE_START("validate-start"),
    VALIDATE_COMPLETE("validate-complete"),
    SEARCH_START("search-start"),
    SEARCH_COMPLETE("search-complete"),
    SEARCH_SKIP("search-skip"),
    SEARCH_ERROR("search-error"),
    FILTER_COMPLETE("filter-complete"),
    SYNTHESIZE_START("synthesize-start"),
    DONE("done");

    private final String wireName;

    ProgressStep(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
