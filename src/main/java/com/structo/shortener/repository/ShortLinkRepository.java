package com.structo.shortener.repository;

import com.structo.shortener.model.ShortLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShortLinkRepository extends JpaRepository<ShortLink, UUID> {

    Optional<ShortLink> findByShortCode(String shortCode);

    boolean existsByShortCode(String shortCode);

    List<ShortLink> findByOwnerIdOrderByCreatedAtDesc(Long ownerId);

    List<ShortLink> findByOwnerIdAndActiveTrueOrderByCreatedAtDesc(Long ownerId);

    /**
     * Single-statement increment evaluated by the database, so concurrent redirects cannot lose updates.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ShortLink s SET s.clickCount = s.clickCount + 1 WHERE s.id = :id")
    int incrementClickCount(@Param("id") UUID id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ShortLink s SET s.active = false, s.updatedAt = :now WHERE s.id = :id AND s.active = true")
    int deactivate(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Raises counters that lag behind their event log. Counters never go down.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ShortLink s SET s.clickCount = (SELECT COUNT(c) FROM ClickEvent c WHERE c.shortLink = s) " +
            "WHERE s.clickCount < (SELECT COUNT(c) FROM ClickEvent c WHERE c.shortLink = s)")
    int reconcileClickCounts();

    @Query("SELECT COALESCE(SUM(s.clickCount), 0) FROM ShortLink s")
    long sumClickCounts();
}
