package com.example.UniScout.model;

public enum OrchestrationState {
    VALIDATING,
    PER_BACKEND_SEARCH,
    FILTER_AND_MERGE,
    SYNTHESIZING,
    DONE,
    DEGRADED
}
