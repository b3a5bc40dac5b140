package com.example.UniScout.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "UniScout API",
                version = "v1",
                description = "Grounded question answering over the knowledge base and allow-listed web sources"
        )
)
public class OpenApiConfig {
}
