package com.example.UniScout.service;

import com.example.UniScout.llm.LanguageModelGateway;
import com.example.UniScout.model.Answer;
import com.example.UniScout.model.CitationRecord;
import com.example.UniScout.model.EvidenceBundle;
import com.example.UniScout.model.QueryHints;
import com.example.UniScout.util.PromptTemplates;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Produces an answer grounded only in the supplied evidence.
 *
 * The raw output is matched exactly (after trimming) against the sentinel
 * tokens; a token embedded in longer text is an ordinary answer.
 * Generation failures become the fixed apology answer and never propagate.
 */
@Service
@RequiredArgsConstructor
public class EvidenceSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(EvidenceSynthesizer.class);

    private final LanguageModelGateway languageModel;
    private final CitationFormatter citationFormatter;

    public Answer synthesize(String query, EvidenceBundle evidence) {
        return synthesize(query, evidence, null);
    }

    public Answer synthesize(String query, EvidenceBundle evidence, QueryHints hints) {
        String prompt = PromptTemplates.synthesis(query, evidence, hints);

        String raw;
        try {
            raw = languageModel.generate(prompt);
        } catch (RuntimeException e) {
            log.warn("Answer generation failed over {} documents: {}", evidence.size(), e.getMessage());
            return Answer.generationFailed();
        }

        if (raw == null || raw.isBlank()) {
            log.warn("Answer generation returned no text over {} documents", evidence.size());
            return Answer.generationFailed();
        }

        String trimmed = raw.trim();
        if (PromptTemplates.DENIED_TOKEN.equals(trimmed)) {
            return Answer.denied();
        }

        List<CitationRecord> citations = citationFormatter.project(evidence);
        if (PromptTemplates.NOT_FOUND_TOKEN.equals(trimmed)) {
            return Answer.notFound(citations);
        }
        return Answer.answered(trimmed, citations);
    }
}
