package com.example.UniScout.search.serper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SerperResponse(List<Item> organic) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(String link, String title, String snippet, Integer position) {}
}
