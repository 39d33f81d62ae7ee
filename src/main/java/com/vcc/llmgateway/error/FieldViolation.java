package com.vcc.llmgateway.error;

/**
 * A single field-level validation failure, e.g. {@code messages[0].role}.
 */
public record FieldViolation(String field, String message) {
}
