package com.structo.shortener.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Redirect lookups, served from {@link RedirectCache} when possible and from the database otherwise.
 *
 * <p>After filling the cache the link is read once more, so a deactivation racing the fill cannot
 * leave a stale entry behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedirectService {

    private final ShortLinkService shortLinkService;
    private final RedirectCache redirectCache;
    private final Clock clock;

    public Optional<RedirectTarget> resolve(String code) {
        Optional<RedirectTarget> cached = redirectCache.get(code);
        if (cached.isPresent()) {
            if (!cached.get().isExpired(clock.instant())) {
                return cached;
            }
            redirectCache.evict(code);
            return Optional.empty();
        }

        Optional<RedirectTarget> target = shortLinkService.resolveForRedirect(code).map(RedirectTarget::of);
        if (target.isEmpty() || !redirectCache.isEnabled()) {
            return target;
        }
        redirectCache.put(code, target.get());

        // a deactivation committed between the read and the put has already run its eviction
        if (shortLinkService.resolveForRedirect(code).isEmpty()) {
            log.debug("Short link {} changed while caching; evicting", code);
            redirectCache.evict(code);
            return Optional.empty();
        }
        return target;
    }
}
