package com.example.UniScout.model;

public record ScoredDocument(KbDocument document, double score) {
}
