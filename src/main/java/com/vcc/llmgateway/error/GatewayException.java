package com.vcc.llmgateway.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Terminal pipeline failure. Carries the {@link ErrorKind} so the handler can
 * render the error envelope; the HTTP status may be overridden per endpoint.
 */
public class GatewayException extends ResponseStatusException {

    private final ErrorKind kind;
    private final List<FieldViolation> violations;

    public GatewayException(ErrorKind kind, String message) {
        this(kind, kind.status(), message, List.of(), null);
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        this(kind, kind.status(), message, List.of(), cause);
    }

    public GatewayException(ErrorKind kind, HttpStatus status, String message) {
        this(kind, status, message, List.of(), null);
    }

    private GatewayException(ErrorKind kind, HttpStatus status, String message,
                             List<FieldViolation> violations, Throwable cause) {
        super(status, message, cause);
        this.kind = kind;
        this.violations = List.copyOf(violations);
    }

    public static GatewayException malformed(List<FieldViolation> violations) {
        String summary = violations.isEmpty()
                ? "Malformed request body"
                : violations.get(0).field() + ": " + violations.get(0).message();
        return new GatewayException(ErrorKind.MALFORMED_REQUEST, HttpStatus.BAD_REQUEST,
                summary, violations, null);
    }

    /**
     * Same failure reported with a different status, e.g. unknown tenant as 404.
     */
    public GatewayException withStatus(HttpStatus status) {
        return new GatewayException(kind, status, getReason(), violations, getCause());
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
