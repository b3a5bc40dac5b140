package com.example.UniScout.model;

public enum BackendStatus {
    /** Backend answered with at least one result. */
    OK,
    /** Backend answered but had nothing (or nothing survived filtering). */
    EMPTY,
    /** Remote error, timeout or malformed payload. */
    ERROR,
    /** Not enabled for this call or missing its credential. */
    SKIPPED
}
