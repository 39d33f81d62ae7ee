package com.vcc.llmgateway.model;

import java.util.Optional;
import java.util.UUID;

/**
 * Structured realtime session identifier {@code tenant:<tenantId>:session:<uuid>}.
 */
public record SessionId(String tenantId, UUID uuid) {

    private static final String TENANT_SEGMENT = "tenant";
    private static final String SESSION_SEGMENT = "session";

    public static SessionId mint(String tenantId) {
        return new SessionId(tenantId, UUID.randomUUID());
    }

    /**
     * Parse a raw identifier. Empty unless it has exactly four colon-delimited
     * segments with the literal markers, a non-blank tenant and a valid UUID.
     */
    public static Optional<SessionId> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] parts = raw.split(":", -1);
        if (parts.length != 4
                || !TENANT_SEGMENT.equals(parts[0])
                || parts[1].isBlank()
                || !SESSION_SEGMENT.equals(parts[2])) {
            return Optional.empty();
        }
        try {
            UUID uuid = UUID.fromString(parts[3]);
            // UUID.fromString is lenient about segment widths
            if (!uuid.toString().equalsIgnoreCase(parts[3])) {
                return Optional.empty();
            }
            return Optional.of(new SessionId(parts[1], uuid));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String value() {
        return TENANT_SEGMENT + ":" + tenantId + ":" + SESSION_SEGMENT + ":" + uuid;
    }

    @Override
    public String toString() {
        return value();
    }
}
