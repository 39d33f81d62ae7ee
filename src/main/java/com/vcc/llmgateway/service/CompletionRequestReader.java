package com.vcc.llmgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.llmgateway.dto.CompletionRequest;
import com.vcc.llmgateway.error.FieldViolation;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.CompletionCommand;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Parses and validates a completion body before any other pipeline stage runs.
 * Failures carry field-level violations and have no side effects.
 */
@Component
public class CompletionRequestReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public CompletionRequestReader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public CompletionCommand read(byte[] body) {
        JsonNode root = parse(body);
        JsonNode messages = root.get("messages");
        if (messages != null && !messages.isNull() && !messages.isArray()) {
            throw violation("messages", "messages must be an array");
        }

        CompletionRequest request;
        try {
            request = objectMapper.treeToValue(root, CompletionRequest.class);
        } catch (JsonMappingException e) {
            throw violation(pathOf(e), "invalid value");
        } catch (JsonProcessingException e) {
            throw violation("body", "Invalid JSON body");
        }

        Set<ConstraintViolation<CompletionRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            List<FieldViolation> fields = violations.stream()
                    .map(v -> new FieldViolation(v.getPropertyPath().toString(), v.getMessage()))
                    .sorted(Comparator.comparing(FieldViolation::field).thenComparing(FieldViolation::message))
                    .toList();
            throw GatewayException.malformed(fields);
        }

        String conversationId = request.conversationId() != null && !request.conversationId().isBlank()
                ? request.conversationId()
                : "conv-" + UUID.randomUUID();
        return new CompletionCommand(request, messages, conversationId);
    }

    private JsonNode parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw violation("body", "Request body is required");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw violation("body", "Request body must be a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw violation("body", "Invalid JSON body");
        }
    }

    private static String pathOf(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            } else if (ref.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(ref.getFieldName());
            }
        }
        return path.length() > 0 ? path.toString() : "body";
    }

    private static GatewayException violation(String field, String message) {
        return GatewayException.malformed(List.of(new FieldViolation(field, message)));
    }
}
