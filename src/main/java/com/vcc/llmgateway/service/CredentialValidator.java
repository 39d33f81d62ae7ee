package com.vcc.llmgateway.service;

import com.vcc.llmgateway.error.ErrorKind;
import com.vcc.llmgateway.error.GatewayException;
import com.vcc.llmgateway.model.Credential;
import com.vcc.llmgateway.model.Identity;
import com.vcc.llmgateway.store.StateStore;
import com.vcc.llmgateway.store.StoreJson;
import com.vcc.llmgateway.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a bearer credential to an identity.
 *
 * Checks, in order:
 * 1. Authorization header present and of the form "Bearer <token>"
 * 2. Credential record exists
 * 3. Credential tenant equals the request tenant
 * 4. Credential not expired
 */
@Service
public class CredentialValidator {
    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    private static final Pattern BEARER = Pattern.compile("^Bearer ([^\\s]+)$");

    private final StateStore store;
    private final StoreKeys keys;
    private final StoreJson json;
    private final Clock clock;

    public CredentialValidator(StateStore store, StoreKeys keys, StoreJson json, Clock clock) {
        this.store = store;
        this.keys = keys;
        this.json = json;
        this.clock = clock;
    }

    public Mono<Identity> validate(String authorizationHeader, String tenantId) {
        String token = extractToken(authorizationHeader);
        if (token == null) {
            return Mono.error(new GatewayException(
                    ErrorKind.MISSING_CREDENTIAL, "Missing or invalid authorization token"));
        }

        String key = keys.credential(token);
        return store.get(key)
                .switchIfEmpty(Mono.error(() -> new GatewayException(
                        ErrorKind.INVALID_CREDENTIAL, "Invalid authorization token")))
                .flatMap(raw -> json.read(key, raw, Credential.class))
                .flatMap(credential -> check(token, credential, tenantId));
    }

    private Mono<Identity> check(String token, Credential credential, String tenantId) {
        if (!tenantId.equals(credential.tenantId())) {
            log.warn("Credential {} used against tenant {} (belongs to {})",
                    maskToken(token), tenantId, credential.tenantId());
            return Mono.error(new GatewayException(
                    ErrorKind.TENANT_MISMATCH, "Credential does not belong to this tenant"));
        }
        if (credential.isExpiredAt(clock.instant())) {
            return Mono.error(new GatewayException(
                    ErrorKind.CREDENTIAL_EXPIRED, "Authorization token expired"));
        }
        Identity identity = new Identity(token, credential);
        log.debug("Resolved identity {} from {}", identity, maskToken(token));
        return Mono.just(identity);
    }

    /**
     * @return the bearer token, or null when the header is absent or malformed
     */
    static String extractToken(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        Matcher matcher = BEARER.matcher(authorizationHeader.trim());
        return matcher.matches() ? matcher.group(1) : null;
    }

    static String maskToken(String token) {
        if (token == null || token.length() < 8) {
            return "****";
        }
        return token.substring(0, 6) + "...";
    }
}
