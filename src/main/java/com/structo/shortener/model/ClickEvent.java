package com.structo.shortener.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * One redirect traversal. Written once, never updated; removed only when its link row is.
 */
@Data
@Entity
@Table(name = "click_event", indexes = {
        @Index(name = "idx_click_event_link_clicked", columnList = "short_link_id, clicked_at"),
        @Index(name = "idx_click_event_country", columnList = "country")
})
public class ClickEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "short_link_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ShortLink shortLink;

    @Column(name = "clicked_at", nullable = false, updatable = false)
    private Instant clickedAt;

    @Column(name = "ip_address", nullable = false, length = 45)
    private String ipAddress;

    @Column(nullable = false, length = 2)
    private String country = "";

    @Column(nullable = false, length = 100)
    private String city = "";

    @Column(nullable = false, length = 50)
    private String browser = "";

    @Column(name = "browser_version", nullable = false, length = 20)
    private String browserVersion = "";

    @Column(nullable = false, length = 50)
    private String os = "";

    @Column(name = "os_version", nullable = false, length = 20)
    private String osVersion = "";

    @Column(name = "device_type", nullable = false, length = 10)
    private DeviceType deviceType = DeviceType.UNKNOWN;

    @Column(nullable = false, length = ShortLink.MAX_URL_LENGTH)
    private String referrer = "";

    @Column(name = "user_agent", nullable = false, columnDefinition = "TEXT")
    private String userAgent = "";
}
