package com.vcc.llmgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One element of a session's append-only history list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryEntry(
        String role,       // "user" or "assistant"
        String type,       // "text" or "audio"
        String content,
        long timestamp     // epoch millis
) {
}
