package com.example.UniScout.llm;

import com.example.UniScout.config.OrchestratorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * {@link LanguageModelGateway} backed by the Spring AI {@link ChatClient}.
 * Each call runs on boundedElastic so the timeout can abandon a stuck HTTP call.
 */
@Component
@RequiredArgsConstructor
public class ChatClientLanguageModelGateway implements LanguageModelGateway {

    private static final ChatOptions CLASSIFY_OPTIONS = ChatOptions.builder()
            .temperature(0.0)
            .maxTokens(100)
            .build();

    private static final ChatOptions GENERATE_OPTIONS = ChatOptions.builder()
            .temperature(0.1)
            .maxTokens(1000)
            .build();

    private final ChatClient chatClient;
    private final OrchestratorProperties properties;

    @Override
    public String classify(String prompt) {
        return call("classify", prompt, CLASSIFY_OPTIONS, properties.classifyTimeout());
    }

    @Override
    public String generate(String prompt) {
        return call("generate", prompt, GENERATE_OPTIONS, properties.generateTimeout());
    }

    private String call(String capability, String prompt, ChatOptions options, Duration timeout) {
        String content;
        try {
            content = Mono.fromCallable(() -> chatClient.prompt()
                            .user(prompt)
                            .options(options)
                            .call()
                            .content())
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                // keep the caller's cancellation visible to the orchestrator
                Thread.currentThread().interrupt();
            }
            throw new LanguageModelException(capability + " call failed: " + e.getMessage(), e);
        }
        if (content == null || content.isBlank()) {
            throw new LanguageModelException(capability + " returned no content");
        }
        return content;
    }
}
