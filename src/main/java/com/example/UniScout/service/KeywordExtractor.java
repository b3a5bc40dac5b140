package com.example.UniScout.service;

import com.example.UniScout.llm.LanguageModelGateway;
import com.example.UniScout.util.PromptTemplates;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts up to five search keywords from a question.
 *
 * Order of attempts:
 *  1. ask the model for a JSON array of keywords
 *  2. reply is not a JSON array: take the words of the reply
 *  3. model call failed: tokenize the question and drop stop words
 */
@Component
@RequiredArgsConstructor
public class KeywordExtractor {

    private static final Logger log = LoggerFactory.getLogger(KeywordExtractor.class);

    static final int MAX_KEYWORDS = 5;

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<String> STOP_WORDS = Set.of(
            "what", "how", "where", "when", "why", "the", "and", "for",
            "are", "can", "will", "do", "does"
    );

    private final LanguageModelGateway languageModel;
    private final ObjectMapper objectMapper;

    public List<String> extract(String query) {
        String reply;
        try {
            reply = languageModel.classify(PromptTemplates.keywordExtraction(query));
        } catch (RuntimeException e) {
            log.warn("Keyword extraction failed, tokenizing query instead: {}", e.getMessage());
            return fromQuery(query);
        }
        return fromReply(reply);
    }

    List<String> fromReply(String reply) {
        try {
            JsonNode node = objectMapper.readTree(reply.trim());
            if (node != null && node.isArray()) {
                List<String> keywords = new ArrayList<>();
                for (JsonNode element : node) {
                    if (element.isTextual() && !element.asText().isBlank()) {
                        keywords.add(element.asText().trim());
                    }
                }
                return keywords.stream().limit(MAX_KEYWORDS).toList();
            }
        } catch (JsonProcessingException e) {
            log.debug("Keyword reply is not JSON: {}", e.getOriginalMessage());
        }
        return words(reply).stream()
                .filter(word -> word.length() > 2)
                .limit(MAX_KEYWORDS)
                .toList();
    }

    static List<String> fromQuery(String query) {
        return words(query).stream()
                .filter(word -> word.length() > 2 && !STOP_WORDS.contains(word))
                .limit(MAX_KEYWORDS)
                .toList();
    }

    private static List<String> words(String text) {
        if (text == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            out.add(matcher.group());
        }
        return out;
    }

    static String quoted(List<String> keywords) {
        return String.join(" ", keywords.stream().map(k -> "\"" + k + "\"").toList());
    }
}
