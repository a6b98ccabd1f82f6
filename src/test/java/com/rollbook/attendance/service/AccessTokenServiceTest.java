package com.rollbook.attendance.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollbook.attendance.config.RollbookProperties;
import com.rollbook.attendance.model.domain.Teacher;

class AccessTokenServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-03T08:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RollbookProperties properties;
    private AccessTokenService tokenService;
    private Teacher teacher;

    @BeforeEach
    void setUp() {
        properties = new RollbookProperties();
        properties.getToken().setSecret("unit-test-secret");
        tokenService = new AccessTokenService(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), properties);
        teacher = Teacher.builder().id(42L).name("Demo Teacher").email("teacher@demo.com").build();
    }

    @Test
    void issuedTokenValidatesToTheTeacher() {
        String token = tokenService.issueToken(teacher);

        AccessTokenService.ValidationResult result = tokenService.validateToken(token);

        assertThat(result.valid()).isTrue();
        assertThat(result.teacherId()).isEqualTo(42L);
        assertThat(result.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
    }

    @Test
    void tokenHasThreeBase64UrlParts() {
        String token = tokenService.issueToken(teacher);

        String[] parts = token.split("\\.");
        assertThat(parts).hasSize(3);
        String header = new String(Base64.getUrlDecoder().decode(parts[0]), StandardCharsets.UTF_8);
        assertThat(header).contains("\"alg\":\"HS256\"");
    }

    @Test
    void tamperedClaimsAreRejected() {
        String token = tokenService.issueToken(teacher);
        String[] parts = token.split("\\.");
        String forgedClaims = Base64.getUrlEncoder().withoutPadding().encodeToString(
                "{\"sub\":\"1\",\"id\":1,\"iss\":\"rollbook\",\"exp\":9999999999}".getBytes(StandardCharsets.UTF_8));

        AccessTokenService.ValidationResult result = tokenService.validateToken(parts[0] + "." + forgedClaims + "." + parts[2]);

        assertThat(result.valid()).isFalse();
        assertThat(result.errorMessage()).isEqualTo("Invalid token signature");
    }

    @Test
    void expiredTokenIsRejected() {
        String token = tokenService.issueToken(teacher);
        AccessTokenService later = new AccessTokenService(objectMapper,
                Clock.fixed(NOW.plus(Duration.ofHours(25)), ZoneOffset.UTC), properties);

        AccessTokenService.ValidationResult result = later.validateToken(token);

        assertThat(result.valid()).isFalse();
        assertThat(result.errorMessage()).isEqualTo("Token has expired");
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        RollbookProperties other = new RollbookProperties();
        other.getToken().setSecret("someone-elses-secret");
        String foreign = new AccessTokenService(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), other).issueToken(teacher);

        assertThat(tokenService.validateToken(foreign).valid()).isFalse();
    }

    @Test
    void garbageIsMalformed() {
        assertThat(tokenService.validateToken("not-a-token").errorMessage()).isEqualTo("Malformed token");
        assertThat(tokenService.validateToken("a.b.c").errorMessage()).isEqualTo("Malformed token");
        assertThat(tokenService.validateToken("").errorMessage()).isEqualTo("Token is required");
    }

    @Test
    void blankSecretFallsBackToRandomSecret() {
        RollbookProperties unset = new RollbookProperties();
        AccessTokenService first = new AccessTokenService(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), unset);
        AccessTokenService second = new AccessTokenService(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), unset);

        String token = first.issueToken(teacher);

        assertThat(first.validateToken(token).valid()).isTrue();
        assertThat(second.validateToken(token).valid()).isFalse();
    }
}
