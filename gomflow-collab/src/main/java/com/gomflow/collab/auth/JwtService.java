package com.gomflow.collab.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gomflow.collab.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * HS256 bearer token verification.
 *
 * The user ID is taken from the {@code sub} claim, falling back to
 * {@code userId}. {@code exp} is required.
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private static final String HEADER_JSON = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";

    private final byte[] secret;
    private final Clock clock;

    public JwtService(String secret, Clock clock) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    /**
     * Issue a token. Tokens are normally issued by the main API; this exists
     * for tooling and tests.
     */
    public String generateToken(String userId, String email, Duration ttl) {
        long now = clock.millis() / 1000;

        ObjectNode claims = Json.MAPPER.createObjectNode();
        claims.put("sub", userId);
        claims.put("email", email);
        claims.put("iat", now);
        claims.put("exp", now + ttl.getSeconds());

        String header = base64Encode(HEADER_JSON);
        String payload = base64Encode(claims.toString());
        return header + "." + payload + "." + sign(header + "." + payload);
    }

    /**
     * Validate token and extract user ID.
     * Returns null if invalid.
     */
    public String validateAndGetUserId(String token) {
        TokenClaims claims = verify(token);
        return claims != null ? claims.userId() : null;
    }

    /**
     * Verify signature and expiry and return the claims, or null if invalid.
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("Invalid token format");
            return null;
        }

        String expectedSig = sign(parts[0] + "." + parts[1]);
        if (!MessageDigest.isEqual(expectedSig.getBytes(StandardCharsets.US_ASCII),
                parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("Invalid token signature");
            return null;
        }

        JsonNode payload;
        try {
            payload = Json.MAPPER.readTree(base64Decode(parts[1]));
        } catch (Exception e) {
            log.debug("Unreadable token payload: {}", e.getMessage());
            return null;
        }

        String userId = payload.path("sub").asText(null);
        if (userId == null || userId.isEmpty()) {
            userId = payload.path("userId").asText(null);
        }
        JsonNode exp = payload.get("exp");
        if (userId == null || userId.isEmpty() || exp == null || !exp.canConvertToLong()) {
            log.debug("Missing required claims");
            return null;
        }

        long expiresAt = exp.asLong() * 1000;
        if (clock.millis() >= expiresAt) {
            log.debug("Token expired");
            return null;
        }

        return new TokenClaims(userId, payload.path("email").asText(null), expiresAt);
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }

    private static String base64Decode(String data) {
        return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
    }

    /**
     * Token claims record.
     */
    public record TokenClaims(
        String userId,
        String email,
        long expiresAt
    ) {}
}
