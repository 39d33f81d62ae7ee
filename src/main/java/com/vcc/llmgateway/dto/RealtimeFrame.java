package com.vcc.llmgateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound realtime frame {@code {inputType, data}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RealtimeFrame(String inputType, String data) {

    public static final String TEXT = "text";
    public static final String AUDIO = "audio";

    @JsonIgnore
    public boolean isText() {
        return TEXT.equals(inputType);
    }

    @JsonIgnore
    public boolean isAudio() {
        return AUDIO.equals(inputType);
    }
}
