package com.vcc.llmgateway.web;

import com.vcc.llmgateway.dto.ErrorResponse;
import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.FieldViolation;
import com.vcc.llmgateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Renders every failure as the local error envelope.
 */
@RestControllerAdvice
public class GatewayExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGateway(GatewayException ex) {
        ErrorKind kind = ex.getKind();
        if (kind.category() == ErrorKind.Category.INTERNAL_ERROR) {
            log.error("Internal failure: {}", ex.getReason(), ex);
        } else {
            log.debug("Request rejected code={} status={} message={}",
                    kind.code(), ex.getStatusCode().value(), ex.getReason());
        }
        return envelope(ex.getStatusCode(), kind.category().wireName(), kind.code(), ex.getReason(),
                ex.getViolations());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        ErrorKind kind = ErrorKind.MALFORMED_REQUEST;
        return envelope(kind.status(), kind.category().wireName(), kind.code(), "Malformed request body",
                List.of());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        ErrorKind.Category category = status.is4xxClientError()
                ? ErrorKind.Category.VALIDATION_ERROR
                : ErrorKind.Category.INTERNAL_ERROR;
        return envelope(status, category.wireName(), "http_" + status.value(), ex.getReason(), List.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected failure", ex);
        ErrorKind kind = ErrorKind.INTERNAL;
        return envelope(kind.status(), kind.category().wireName(), kind.code(), "Internal server error",
                List.of());
    }

    private static ResponseEntity<ErrorResponse> envelope(HttpStatusCode status, String type, String code,
                                                          String message, List<FieldViolation> fields) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(type, code, message, fields));
    }
}
