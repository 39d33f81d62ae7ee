package com.vcc.llmgateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outbound realtime frame {@code {outputType, data}}.
 */
public record RealtimeReply(String outputType, String data) {

    public static final String ERROR = "error";

    public static RealtimeReply text(String data) {
        return new RealtimeReply(RealtimeFrame.TEXT, data);
    }

    public static RealtimeReply audio(String data) {
        return new RealtimeReply(RealtimeFrame.AUDIO, data);
    }

    public static RealtimeReply error(String message) {
        return new RealtimeReply(ERROR, message);
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR.equals(outputType);
    }
}
