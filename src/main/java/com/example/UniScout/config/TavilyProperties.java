package com.example.UniScout.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "uniscout.tavily")
@Validated
public record TavilyProperties(
        @DefaultValue("https://api.tavily.com") @NotBlank String baseUrl,
        String apiKey,
        @DefaultValue("10000") @Min(200) int timeoutMs,
        @DefaultValue("true") boolean includeRawContent
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
