package com.example.UniScout.search.tavily;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TavilyResponse(List<Item> results) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            String title,
            String url,
            String content,
            @JsonProperty("raw_content") String rawContent,
            Double score
    ) {}
}
