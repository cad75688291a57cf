package com.example.Lily.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * One imported repair guide or blog article. Metadata holds whatever the import kept,
 * e.g. {"url": "...", "appliance": "..."}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KbDocument {
    private Long id;
    private String docType;
    private String content;
    private JsonNode metadata;

    /**
     * Link to the original guide or article, or null if the import kept none.
     */
    public String sourceUrl() {
        if (metadata == null || !metadata.hasNonNull("url")) {
            return null;
        }
        String url = metadata.get("url").asText().trim();
        return url.isEmpty() ? null : url;
    }
}
