package com.example.UniScout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param provider preferred chat model provider ("deepseek" or "openai")
 */
@ConfigurationProperties(prefix = "uniscout.llm")
public record LlmProperties(
        @DefaultValue("deepseek") String provider
) {
}
