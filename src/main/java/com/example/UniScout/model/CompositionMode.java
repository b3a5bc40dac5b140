package com.example.UniScout.model;

/**
 * How results from several backends become one answer.
 */
public enum CompositionMode {
    /** One merged evidence bundle, synthesized once. */
    MERGED,
    /** One synthesis per backend; usable answers are joined under provenance headers. */
    PER_BACKEND
}
