package com.example.UniScout.service;

import com.example.UniScout.llm.LanguageModelGateway;
import com.example.UniScout.model.ClassificationVerdict;
import com.example.UniScout.util.PromptTemplates;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a query belongs to the allowed topic set.
 *
 * Fails open: any error from the classify capability yields {@code inDomain=true},
 * so a broken classifier never blocks a legitimate question.
 */
@Service
@RequiredArgsConstructor
public class QueryClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    private final LanguageModelGateway languageModel;

    public ClassificationVerdict classify(String query) {
        String verdict;
        try {
            verdict = languageModel.classify(PromptTemplates.classification(query));
        } catch (RuntimeException e) {
            log.warn("Query classification failed, allowing query: {}", e.getMessage());
            return ClassificationVerdict.failOpen();
        }

        if (PromptTemplates.DENIED_TOKEN.equals(verdict == null ? null : verdict.trim())) {
            log.debug("Query classified out of domain: '{}'", query);
            return ClassificationVerdict.denied();
        }
        return ClassificationVerdict.allowed();
    }
}
