package com.example.UniScout.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SearchDepth {
    BASIC,
    ADVANCED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SearchDepth fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return SearchDepth.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
