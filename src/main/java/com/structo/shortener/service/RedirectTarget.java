package com.structo.shortener.service;

import com.structo.shortener.model.ShortLink;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RedirectTarget {
    UUID linkId;
    String originalUrl;
    Instant expiresAt;

    public static RedirectTarget of(ShortLink link) {
        return new RedirectTarget(link.getId(), link.getOriginalUrl(), link.getExpiresAt());
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
