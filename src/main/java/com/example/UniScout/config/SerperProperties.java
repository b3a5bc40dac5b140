package com.example.UniScout.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "uniscout.serper")
@Validated
public record SerperProperties(
        @DefaultValue("https://google.serper.dev") @NotBlank String baseUrl,
        String apiKey,
        @DefaultValue("5000") @Min(200) int timeoutMs
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
