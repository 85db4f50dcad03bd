package com.dcruver.themerank.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single post taken from the document source.
 * Read-only once ingested; clusters refer to documents by index.
 */
@Value
@Builder
public class Document {
    String id;
    String text;

    // Source metadata
    String community;
    String url;
    Instant createdAt;
    double score;

    public boolean isValid() {
        return text != null && !text.isBlank();
    }

    /**
     * Short single-line preview for logs and reports
     */
    public String excerpt(int maxLength) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= maxLength ? flat : flat.substring(0, maxLength);
    }
}
