package com.vcc.llmgateway.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * JSON (de)serialization of store values.
 * A value that cannot be read is a corrupt record and surfaces as an internal error.
 */
@Component
public class StoreJson {
    private static final Logger log = LoggerFactory.getLogger(StoreJson.class);

    private final ObjectMapper objectMapper;

    public StoreJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> Mono<T> read(String key, String json, Class<T> type) {
        try {
            return Mono.just(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.error("Corrupt store value key={} type={}: {}", key, type.getSimpleName(), e.getOriginalMessage());
            return Mono.error(new GatewayException(ErrorKind.INTERNAL, "Corrupt record in state store", e));
        }
    }

    public Mono<String> write(Object value) {
        try {
            return Mono.just(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            return Mono.error(new GatewayException(ErrorKind.INTERNAL, "Failed to serialize for state store", e));
        }
    }
}
