package com.example.UniScout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Row of the {@code kb_documents} table. Title and source url live in the
 * JSON metadata column.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KbDocument {
    private Long id;
    private String docType;
    private String content;
    private JsonNode metadata;

    public String metadataText(String field) {
        if (metadata == null) {
            return null;
        }
        JsonNode node = metadata.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
