package com.vcc.llmgateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class NonEmptyContentValidator implements ConstraintValidator<NonEmptyContent, JsonNode> {

    @Override
    public boolean isValid(JsonNode content, ConstraintValidatorContext context) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return false;
        }
        if (content.isTextual()) {
            return !content.asText().isEmpty();
        }
        if (content.isContainerNode()) {
            return content.size() > 0;
        }
        return true;
    }
}
