package com.vantage.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts a {@link RequestPrincipal} from an {@code Authorization: Bearer} header.
 *
 * Tokens are JWTs whose signature has already been verified by the API
 * gateway in front of this service; only the payload claims are read here.
 *
 * Claims:
 * - {@code sub}: user id (required)
 * - {@code tenant_id}: tenant id (required)
 * - {@code permissions}: array of {@link Permission} names; unknown names are ignored
 */
@Component
public class BearerTokenDecoder {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenDecoder.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final ObjectMapper objectMapper;

    public BearerTokenDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the principal, or empty when the header is absent or the token is unusable
     */
    public Optional<RequestPrincipal> decode(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String token = authorizationHeader.trim();
        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length()).trim();
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            log.warn("Rejected bearer token that is not a JWT");
            return Optional.empty();
        }

        JsonNode claims;
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            claims = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | IOException e) {
            log.warn("Rejected bearer token with unreadable payload: {}", e.getMessage());
            return Optional.empty();
        }

        String userId = claims.path("sub").asText(null);
        String tenantId = claims.path("tenant_id").asText(null);
        if (userId == null || userId.isBlank() || tenantId == null || tenantId.isBlank()) {
            log.warn("Rejected bearer token without sub or tenant_id claim");
            return Optional.empty();
        }

        Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        for (JsonNode name : claims.path("permissions")) {
            try {
                permissions.add(Permission.valueOf(name.asText()));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unknown permission claim {}", name.asText());
            }
        }
        return Optional.of(new RequestPrincipal(userId, tenantId, permissions));
    }
}
