package com.structo.shortener.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

@Service
public class JwtService {

    static final String USER_ID_CLAIM = "uid";

    private final SecretKey signingKey;
    private final Duration ttl;
    private final Clock clock;

    public JwtService(@Value("${security.jwt.secret}") String secret,
                      @Value("${security.jwt.ttl-seconds}") long ttlSeconds,
                      Clock clock) {
        // HS256 needs a secret of at least 32 bytes
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.clock = clock;
    }

    public String generateToken(Long userId, String email) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(email)
                .claim(USER_ID_CLAIM, userId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public Claims validateToken(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    /**
     * Throws {@link io.jsonwebtoken.JwtException} for a forged, malformed or expired token.
     */
    public Long extractUserId(String token) {
        return validateToken(token).get(USER_ID_CLAIM, Long.class);
    }
}
