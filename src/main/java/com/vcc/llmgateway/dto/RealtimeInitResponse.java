package com.vcc.llmgateway.dto;

public record RealtimeInitResponse(
        String sessionId,
        String connectionUrl,
        long remainingBudget
) {
}
