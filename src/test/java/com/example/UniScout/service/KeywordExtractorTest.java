package com.example.UniScout.service;

import com.example.UniScout.llm.LanguageModelException;
import com.example.UniScout.llm.LanguageModelGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class KeywordExtractorTest {

    private LanguageModelGateway languageModel;
    private KeywordExtractor extractor;

    @BeforeEach
    void setUp() {
        languageModel = mock(LanguageModelGateway.class);
        extractor = new KeywordExtractor(languageModel, new ObjectMapper());
    }

    @Test
    void jsonArrayReplyIsUsedAndCappedAtFive() {
        when(languageModel.classify(anyString()))
                .thenReturn("[\"financial aid\", \"application\", \"apply\", \"grant\", \"deadline\", \"extra\"]");

        assertThat(extractor.extract("How do I apply for financial aid?"))
                .containsExactly("financial aid", "application", "apply", "grant", "deadline");
    }

    @Test
    void nonJsonReplyFallsBackToItsWords() {
        when(languageModel.classify(anyString())).thenReturn("Keywords: robotics, minor, requirements");

        assertThat(extractor.extract("What are the requirements for the robotics minor?"))
                .containsExactly("keywords", "robotics", "minor", "requirements");
    }

    @Test
    void failedCallTokenizesQueryWithoutStopWords() {
        when(languageModel.classify(anyString())).thenThrow(new LanguageModelException("down"));

        assertThat(extractor.extract("What are the tuition fees and payment plans for international students?"))
                .containsExactly("tuition", "fees", "payment", "plans", "international");
    }

    @Test
    void quotedJoinsKeywords() {
        assertThat(KeywordExtractor.quoted(java.util.List.of("financial aid", "grant")))
                .isEqualTo("\"financial aid\" \"grant\"");
    }
}
