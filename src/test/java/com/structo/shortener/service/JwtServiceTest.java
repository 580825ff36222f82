package com.structo.shortener.service;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0123456789";
    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private static JwtService serviceAt(Instant instant) {
        return new JwtService(SECRET, 3600, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void generatedTokenCarriesUserId() {
        JwtService jwtService = serviceAt(NOW);
        String token = jwtService.generateToken(42L, "a@example.com");

        assertThat(jwtService.validateToken(token).getSubject()).isEqualTo("a@example.com");
        assertThat(jwtService.extractUserId(token)).isEqualTo(42L);
    }

    @Test
    void tokenExpiresAfterTtl() {
        String token = serviceAt(NOW).generateToken(42L, "a@example.com");

        assertThat(serviceAt(NOW.plusSeconds(3599)).extractUserId(token)).isEqualTo(42L);
        assertThatThrownBy(() -> serviceAt(NOW.plusSeconds(3601)).extractUserId(token))
                .isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        JwtService other = new JwtService("another-secret-another-secret-another-secret-42", 3600,
                Clock.fixed(NOW, ZoneOffset.UTC));
        String token = other.generateToken(42L, "a@example.com");

        assertThatThrownBy(() -> serviceAt(NOW).extractUserId(token)).isInstanceOf(JwtException.class);
    }
}
