package com.vcc.llmgateway.dto;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Message content must be present and not empty (blank string, empty array or object).
 */
@Documented
@Constraint(validatedBy = NonEmptyContentValidator.class)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface NonEmptyContent {

    String message() default "content is required";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
