package com.structo.shortener.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A short code mapped to its original URL.
 *
 * <p>Rows are never physically removed; deactivation flips {@code active}. Codes are unique across
 * active and inactive links, so a code is never handed out twice.
 */
@Data
@Entity
@Table(name = "short_link",
        uniqueConstraints = @UniqueConstraint(name = "uk_short_link_code", columnNames = "short_code"),
        indexes = {
                @Index(name = "idx_short_link_code", columnList = "short_code"),
                @Index(name = "idx_short_link_owner_active", columnList = "owner_id, is_active")
        })
public class ShortLink {

    public static final int MAX_URL_LENGTH = 2048;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "original_url", nullable = false, length = MAX_URL_LENGTH)
    private String originalUrl;

    @Column(name = "short_code", nullable = false, length = 20, updatable = false)
    private String shortCode;

    @Column(name = "is_custom_code", nullable = false, updatable = false)
    private boolean customCode;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private AppUser owner;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "click_count", nullable = false)
    private long clickCount;

    /**
     * Expired once {@code now} reaches {@code expiresAt}; a link expiring exactly now is expired.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isResolvable(Instant now) {
        return active && !isExpired(now);
    }

    public boolean isOwnedBy(Long userId) {
        return userId != null && owner != null && userId.equals(owner.getId());
    }
}
