package com.structo.shortener.service;

import com.structo.shortener.dto.ShortLinkResponse;
import com.structo.shortener.exception.AnonymousCustomCodeException;
import com.structo.shortener.exception.ShortLinkNotFoundException;
import com.structo.shortener.model.AppUser;
import com.structo.shortener.model.ShortLink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Link operations as seen by API callers: ownership, visibility and response shaping.
 *
 * <p>A link owned by someone else is reported exactly like a missing one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShortLinkService {

    private final ShorteningService shorteningService;
    private final ShortLinkRegistry shortLinkRegistry;
    private final RedirectCache redirectCache;
    private final Clock clock;

    @Value("${app.base-url}")
    private String baseUrl;

    public ShortLink shorten(String url, String customCode, Integer ttlSeconds, AppUser actingUser) {
        if (customCode != null && !customCode.isEmpty() && actingUser == null) {
            throw new AnonymousCustomCodeException();
        }
        Instant expiresAt = ttlSeconds != null && ttlSeconds > 0
                ? clock.instant().plusSeconds(ttlSeconds)
                : null;
        ShortLink link = shorteningService.create(url, actingUser, customCode, expiresAt);
        log.info("Created short link {} (custom={}, owner={})",
                link.getShortCode(), link.isCustomCode(), actingUser == null ? "anonymous" : actingUser.getId());
        return link;
    }

    /**
     * Active, unexpired link for the code, or empty. Never-issued, deactivated and expired codes look the same.
     */
    public Optional<ShortLink> resolveForRedirect(String code) {
        Instant now = clock.instant();
        return shortLinkRegistry.resolve(code).filter(link -> link.isResolvable(now));
    }

    /**
     * Owners see their links in any state; everyone else only sees resolvable ones.
     */
    public ShortLink findVisible(String code, Long userId) {
        Instant now = clock.instant();
        return shortLinkRegistry.resolve(code)
                .filter(link -> link.isOwnedBy(userId) || link.isResolvable(now))
                .orElseThrow(ShortLinkNotFoundException::new);
    }

    public ShortLink findOwned(String code, Long userId) {
        return shortLinkRegistry.resolve(code)
                .filter(link -> link.isOwnedBy(userId))
                .orElseThrow(ShortLinkNotFoundException::new);
    }

    public List<ShortLink> listOwned(Long userId, boolean activeOnly) {
        return shortLinkRegistry.listForOwner(userId, activeOnly);
    }

    public void deactivate(String code, Long userId) {
        ShortLink link = findOwned(code, userId);
        shortLinkRegistry.deactivate(link.getId());
        redirectCache.evict(link.getShortCode());
        log.info("Deactivated short link {}", link.getShortCode());
    }

    public ShortLinkResponse toResponse(ShortLink link, boolean ownerView) {
        ShortLinkResponse response = new ShortLinkResponse();
        response.setShortCode(link.getShortCode());
        response.setShortUrl(shortUrl(link));
        response.setOriginalUrl(link.getOriginalUrl());
        response.setCreatedAt(link.getCreatedAt());
        response.setExpiresAt(link.getExpiresAt());
        response.setClickCount(link.getClickCount());
        response.setCustomCode(link.isCustomCode());
        if (ownerView) {
            response.setActive(link.isActive());
            response.setExpired(link.isExpired(clock.instant()));
        }
        return response;
    }

    public List<ShortLinkResponse> toResponses(List<ShortLink> links, boolean ownerView) {
        return links.stream()
                .map(link -> toResponse(link, ownerView))
                .collect(Collectors.toList());
    }

    public String shortUrl(ShortLink link) {
        return baseUrl.replaceAll("/+$", "") + "/" + link.getShortCode();
    }
}
