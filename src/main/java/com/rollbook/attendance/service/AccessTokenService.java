package com.rollbook.attendance.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollbook.attendance.config.RollbookProperties;
import com.rollbook.attendance.exception.InvalidTokenException;
import com.rollbook.attendance.model.domain.Teacher;

import lombok.extern.slf4j.Slf4j;

/**
 * Issues and verifies teacher access tokens.
 *
 * Tokens use the compact JWT layout {@code header.claims.signature}, each part
 * base64url without padding, signed with HMAC-SHA256:
 *
 * - header: {"alg":"HS256","typ":"JWT"}
 * - claims: sub/id (teacher id), iss, iat, exp (epoch seconds)
 */
@Service
@Slf4j
public class AccessTokenService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String HEADER_JSON = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RollbookProperties.TokenConfig tokenConfig;
    private final byte[] secret;

    public AccessTokenService(ObjectMapper objectMapper, Clock clock, RollbookProperties properties) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.tokenConfig = properties.getToken();

        String configured = tokenConfig.getSecret();
        if (configured == null || configured.isBlank()) {
            log.warn("rollbook.token.secret is not set; using a random per-process secret. "
                    + "Issued tokens will not survive a restart.");
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            this.secret = random;
        } else {
            this.secret = configured.getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * Result of verifying a token.
     */
    public record ValidationResult(
            boolean valid,
            Long teacherId,
            Instant expiresAt,
            String errorMessage
    ) {
        public static ValidationResult success(Long teacherId, Instant expiresAt) {
            return new ValidationResult(true, teacherId, expiresAt, null);
        }

        public static ValidationResult failure(String errorMessage) {
            return new ValidationResult(false, null, null, errorMessage);
        }
    }

    /**
     * Issue a token for a teacher, valid for the configured number of hours.
     */
    public String issueToken(Teacher teacher) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plus(Duration.ofHours(tokenConfig.getExpirationHours()));

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", String.valueOf(teacher.getId()));
        claims.put("id", teacher.getId());
        claims.put("iss", tokenConfig.getIssuer());
        claims.put("iat", issuedAt.getEpochSecond());
        claims.put("exp", expiresAt.getEpochSecond());

        String payload;
        try {
            payload = ENCODER.encodeToString(objectMapper.writeValueAsBytes(claims));
        } catch (JsonProcessingException e) {
            throw new InvalidTokenException("Failed to encode token claims", e);
        }

        String signingInput = ENCODER.encodeToString(HEADER_JSON.getBytes(StandardCharsets.UTF_8)) + "." + payload;
        log.debug("Issued token for teacher {} expiring at {}", teacher.getId(), expiresAt);
        return signingInput + "." + ENCODER.encodeToString(sign(signingInput));
    }

    /**
     * Verify signature, issuer and expiry of a token.
     */
    public ValidationResult validateToken(String token) {
        if (token == null || token.isBlank()) {
            return ValidationResult.failure("Token is required");
        }

        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            return ValidationResult.failure("Malformed token");
        }

        byte[] providedSignature;
        JsonNode claims;
        try {
            providedSignature = DECODER.decode(parts[2]);
            claims = objectMapper.readTree(DECODER.decode(parts[1]));
        } catch (IllegalArgumentException | IOException e) {
            return ValidationResult.failure("Malformed token");
        }

        byte[] expectedSignature = sign(parts[0] + "." + parts[1]);
        if (!MessageDigest.isEqual(expectedSignature, providedSignature)) {
            return ValidationResult.failure("Invalid token signature");
        }

        if (claims == null || !claims.isObject()) {
            return ValidationResult.failure("Malformed token");
        }

        if (!tokenConfig.getIssuer().equals(claims.path("iss").asText(null))) {
            return ValidationResult.failure("Unexpected token issuer");
        }

        JsonNode id = claims.get("id");
        if (id == null || !id.isIntegralNumber()) {
            return ValidationResult.failure("Token carries no teacher id");
        }

        JsonNode exp = claims.get("exp");
        if (exp == null || !exp.isIntegralNumber()) {
            return ValidationResult.failure("Token carries no expiry");
        }

        Instant expiresAt = Instant.ofEpochSecond(exp.asLong());
        if (!clock.instant().isBefore(expiresAt)) {
            return ValidationResult.failure("Token has expired");
        }

        return ValidationResult.success(id.asLong(), expiresAt);
    }

    private byte[] sign(String input) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            return mac.doFinal(input.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new InvalidTokenException("Failed to sign token", e);
        }
    }
}
