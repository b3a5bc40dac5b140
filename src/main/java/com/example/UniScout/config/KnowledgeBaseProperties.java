package com.example.UniScout.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param enabled  the vector corpus is provisioned for this deployment
 * @param minScore similarity floor; hits below it are dropped before merging
 */
@ConfigurationProperties(prefix = "uniscout.knowledge-base")
@Validated
public record KnowledgeBaseProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("0.25") @DecimalMin("0.0") @DecimalMax("1.0") double minScore
) {
}
