package com.example.UniScout.model;

/**
 * @param inDomain   whether the query may be answered
 * @param failedOpen true when the classifier call failed and the verdict is the permissive default
 */
public record ClassificationVerdict(boolean inDomain, boolean failedOpen) {

    public static ClassificationVerdict allowed() {
        return new ClassificationVerdict(true, false);
    }

    public static ClassificationVerdict denied() {
        return new ClassificationVerdict(false, false);
    }

    public static ClassificationVerdict failOpen() {
        return new ClassificationVerdict(true, true);
    }
}
