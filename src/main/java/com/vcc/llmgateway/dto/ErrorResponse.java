package com.vcc.llmgateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vcc.llmgateway.error.FieldViolation;

import java.util.List;

/**
 * Local error envelope {@code {"error": {...}}}.
 */
public record ErrorResponse(Body error) {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Body(String type, String code, String message, List<FieldViolation> fields) {
    }

    public static ErrorResponse of(String type, String code, String message, List<FieldViolation> fields) {
        return new ErrorResponse(new Body(type, code, message, fields));
    }
}
