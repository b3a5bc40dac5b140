package com.example.UniScout.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiConfig {

    private static final String SYSTEM_PROMPT =
            "You are UniScout, an assistant that answers VinUni questions from supplied documents only.";

    /**
     * Build the ChatClient used for both classification and generation.
     * The configured provider wins when its model bean exists; otherwise fall back
     * to whichever of DeepSeek / OpenAI is available
     * (so a missing API key for one provider does not break the app).
     */
    @Bean
    public ChatClient chatClient(
            LlmProperties llmProperties,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();

        if ("openai".equalsIgnoreCase(llmProperties.provider()) && openAiModel != null) {
            return ChatClient.builder(openAiModel).defaultSystem(SYSTEM_PROMPT).build();
        }
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel).defaultSystem(SYSTEM_PROMPT).build();
        }
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel).defaultSystem(SYSTEM_PROMPT).build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }
}
