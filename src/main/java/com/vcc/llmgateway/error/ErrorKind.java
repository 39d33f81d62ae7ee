package com.vcc.llmgateway.error;

import org.springframework.http.HttpStatus;

/**
 * Every failure the gateway can report, with its category and default status.
 */
public enum ErrorKind {

    MALFORMED_REQUEST(Category.VALIDATION_ERROR, HttpStatus.BAD_REQUEST),
    UNKNOWN_TENANT(Category.VALIDATION_ERROR, HttpStatus.BAD_REQUEST),
    MISSING_TENANT_HEADER(Category.VALIDATION_ERROR, HttpStatus.BAD_REQUEST),
    UNSUPPORTED_BACKEND(Category.VALIDATION_ERROR, HttpStatus.BAD_REQUEST),

    MISSING_CREDENTIAL(Category.AUTHENTICATION_ERROR, HttpStatus.UNAUTHORIZED),
    INVALID_CREDENTIAL(Category.AUTHENTICATION_ERROR, HttpStatus.UNAUTHORIZED),
    CREDENTIAL_EXPIRED(Category.AUTHENTICATION_ERROR, HttpStatus.UNAUTHORIZED),

    TENANT_MISMATCH(Category.AUTHORIZATION_ERROR, HttpStatus.FORBIDDEN),
    UNKNOWN_GROUP(Category.AUTHORIZATION_ERROR, HttpStatus.FORBIDDEN),
    PROVIDER_UNCONFIGURED(Category.AUTHORIZATION_ERROR, HttpStatus.FORBIDDEN),

    INSUFFICIENT_BUDGET(Category.QUOTA_EXCEEDED, HttpStatus.TOO_MANY_REQUESTS),
    RATE_LIMIT_EXCEEDED(Category.QUOTA_EXCEEDED, HttpStatus.TOO_MANY_REQUESTS),

    UPSTREAM_UNREACHABLE(Category.UPSTREAM_ERROR, HttpStatus.INTERNAL_SERVER_ERROR),

    INTERNAL(Category.INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR);

    public enum Category {
        VALIDATION_ERROR("validation_error"),
        AUTHENTICATION_ERROR("authentication_error"),
        AUTHORIZATION_ERROR("authorization_error"),
        QUOTA_EXCEEDED("quota_exceeded"),
        UPSTREAM_ERROR("upstream_error"),
        INTERNAL_ERROR("internal_error");

        private final String wireName;

        Category(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    private final Category category;
    private final HttpStatus status;

    ErrorKind(Category category, HttpStatus status) {
        this.category = category;
        this.status = status;
    }

    public Category category() {
        return category;
    }

    public HttpStatus status() {
        return status;
    }

    /**
     * Wire code, e.g. {@code insufficient_budget}.
     */
    public String code() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
