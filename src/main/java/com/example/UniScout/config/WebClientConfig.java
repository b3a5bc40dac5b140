package com.example.UniScout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    WebClient tavilyWebClient(WebClient.Builder builder, TavilyProperties props) {
        return builder.clone()
                .baseUrl(props.baseUrl())
                .clientConnector(connector(props.timeoutMs()))
                .build();
    }

    @Bean
    WebClient serperWebClient(WebClient.Builder builder, SerperProperties props) {
        WebClient.Builder b = builder.clone()
                .baseUrl(props.baseUrl())
                .clientConnector(connector(props.timeoutMs()));
        if (props.hasApiKey()) {
            b.defaultHeader("X-API-KEY", props.apiKey());
        }
        return b.build();
    }

    private static ReactorClientHttpConnector connector(long timeoutMs) {
        return new ReactorClientHttpConnector(HttpClient.create().responseTimeout(Duration.ofMillis(timeoutMs)));
    }
}
