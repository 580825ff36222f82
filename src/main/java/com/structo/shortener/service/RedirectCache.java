package com.structo.shortener.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache of redirect targets, keyed by short code.
 *
 * <p>Entries never outlive the link's expiry and are evicted on deactivation. Redis being down is
 * not an error here: reads miss and writes are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedirectCache {

    private static final String KEY_PREFIX = "short-link:";
    private static final String NO_EXPIRY = "-";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    @Value("${app.cache.enabled:true}")
    private boolean enabled = true;

    @Value("${app.cache.max-ttl-seconds:86400}")
    private long maxTtlSeconds = 86400;

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<RedirectTarget> get(String code) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            String cached = redisTemplate.opsForValue().get(KEY_PREFIX + code);
            return cached == null ? Optional.empty() : Optional.of(decode(cached));
        } catch (DataAccessException e) {
            log.warn("Redirect cache read failed for {}: {}", code, e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Discarding malformed redirect cache entry for {}", code);
            evict(code);
            return Optional.empty();
        }
    }

    public void put(String code, RedirectTarget target) {
        if (!enabled) {
            return;
        }
        long ttlMillis = TimeUnit.SECONDS.toMillis(maxTtlSeconds);
        if (target.getExpiresAt() != null) {
            long remaining = target.getExpiresAt().toEpochMilli() - clock.millis();
            ttlMillis = Math.min(ttlMillis, remaining);
        }
        if (ttlMillis <= 0) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + code, encode(target), ttlMillis, TimeUnit.MILLISECONDS);
        } catch (DataAccessException e) {
            log.warn("Redirect cache write failed for {}: {}", code, e.getMessage());
        }
    }

    public void evict(String code) {
        if (!enabled) {
            return;
        }
        try {
            redisTemplate.delete(KEY_PREFIX + code);
        } catch (DataAccessException e) {
            log.warn("Redirect cache eviction failed for {}: {}", code, e.getMessage());
        }
    }

    static String encode(RedirectTarget target) {
        String expiry = target.getExpiresAt() == null ? NO_EXPIRY : Long.toString(target.getExpiresAt().toEpochMilli());
        return target.getLinkId() + "|" + expiry + "|" + target.getOriginalUrl();
    }

    static RedirectTarget decode(String value) {
        String[] parts = value.split("\\|", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed cache entry");
        }
        Instant expiresAt = NO_EXPIRY.equals(parts[1]) ? null : Instant.ofEpochMilli(Long.parseLong(parts[1]));
        return new RedirectTarget(UUID.fromString(parts[0]), parts[2], expiresAt);
    }
}
