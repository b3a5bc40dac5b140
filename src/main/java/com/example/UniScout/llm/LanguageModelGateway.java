package com.example.UniScout.llm;

/**
 * The two text capabilities the orchestrator needs from a language model.
 * Both block until the model answers or the configured timeout elapses.
 */
public interface LanguageModelGateway {

    /**
     * Short, deterministic completion used for verdicts and keyword lists.
     *
     * @throws LanguageModelException on network error, timeout or empty output
     */
    String classify(String prompt);

    /**
     * Long-form completion used for answer synthesis.
     *
     * @throws LanguageModelException on network error, timeout or empty output
     */
    String generate(String prompt);
}
