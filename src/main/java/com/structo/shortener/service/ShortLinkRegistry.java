package com.structo.shortener.service;

import com.structo.shortener.exception.DuplicateCodeException;
import com.structo.shortener.model.AppUser;
import com.structo.shortener.model.ShortLink;
import com.structo.shortener.repository.ShortLinkRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the short code to URL mapping.
 *
 * <p>Code uniqueness is left to the database constraint: {@link #insert} flushes immediately and
 * reports a violation on the code as {@link DuplicateCodeException}. No method here runs inside a
 * caller's transaction, so a rejected insert leaves nothing to roll back.
 */
@Service
@RequiredArgsConstructor
public class ShortLinkRegistry {

    private final ShortLinkRepository shortLinkRepository;
    private final Clock clock;

    public ShortLink insert(String originalUrl, String shortCode, boolean customCode, AppUser owner) {
        return insert(originalUrl, shortCode, customCode, owner, null);
    }

    public ShortLink insert(String originalUrl, String shortCode, boolean customCode, AppUser owner, Instant expiresAt) {
        ShortLink link = new ShortLink();
        link.setOriginalUrl(originalUrl);
        link.setShortCode(shortCode);
        link.setCustomCode(customCode);
        link.setOwner(owner);
        link.setExpiresAt(expiresAt);
        try {
            return shortLinkRepository.saveAndFlush(link);
        } catch (DataIntegrityViolationException e) {
            if (shortLinkRepository.existsByShortCode(shortCode)) {
                throw new DuplicateCodeException(shortCode, e);
            }
            throw e;
        }
    }

    /**
     * Returns the stored link whether or not it is still resolvable.
     */
    public Optional<ShortLink> resolve(String shortCode) {
        return shortLinkRepository.findByShortCode(shortCode);
    }

    public ShortLink reference(UUID id) {
        return shortLinkRepository.getReferenceById(id);
    }

    public void incrementClickCount(UUID id) {
        shortLinkRepository.incrementClickCount(id);
    }

    public void deactivate(UUID id) {
        shortLinkRepository.deactivate(id, clock.instant());
    }

    public List<ShortLink> listForOwner(Long ownerId, boolean activeOnly) {
        return activeOnly
                ? shortLinkRepository.findByOwnerIdAndActiveTrueOrderByCreatedAtDesc(ownerId)
                : shortLinkRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }
}
