package com.example.UniScout.model;

import com.example.UniScout.util.AnswerMessages;

import java.util.List;

/**
 * Result of one synthesis pass.
 *
 * @param text      user-visible answer text
 * @param sentinel  control signal derived from the raw generation output
 * @param citations projected evidence, empty for denied and fallback answers
 * @param fallback  true when generation failed and {@code text} is the fixed apology
 */
public record Answer(
        String text,
        Sentinel sentinel,
        List<CitationRecord> citations,
        boolean fallback
) {
    public Answer {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static Answer answered(String text, List<CitationRecord> citations) {
        return new Answer(text, Sentinel.NONE, citations, false);
    }

    public static Answer denied() {
        return new Answer(AnswerMessages.DENIED, Sentinel.DENIED, List.of(), false);
    }

    public static Answer notFound(List<CitationRecord> citations) {
        return new Answer(AnswerMessages.NOT_FOUND, Sentinel.NOT_FOUND, citations, false);
    }

    public static Answer nothingFound() {
        return new Answer(AnswerMessages.NOTHING_FOUND, Sentinel.NONE, List.of(), false);
    }

    public static Answer generationFailed() {
        return new Answer(AnswerMessages.GENERATION_FAILED, Sentinel.NONE, List.of(), true);
    }

    /**
     * A usable answer is a grounded one: not a sentinel and not the apology.
     */
    public boolean isUsable() {
        return sentinel == Sentinel.NONE && !fallback;
    }
}
