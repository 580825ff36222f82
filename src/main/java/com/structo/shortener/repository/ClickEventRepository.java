package com.structo.shortener.repository;

import com.structo.shortener.dto.DailyCount;
import com.structo.shortener.dto.NamedCount;
import com.structo.shortener.model.ClickEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read side of the click log. Categorical queries drop empty values and order by count, then by
 * value, so equal counts always come back in the same order.
 */
@Repository
public interface ClickEventRepository extends JpaRepository<ClickEvent, Long> {

    long countByShortLinkId(UUID shortLinkId);

    @Query("SELECT COUNT(DISTINCT c.ipAddress) FROM ClickEvent c WHERE c.shortLink.id = :linkId")
    long countDistinctIpAddresses(@Param("linkId") UUID linkId);

    /**
     * Clicks per calendar day, oldest first. Days are cut in the database session's time zone, which the
     * connection pool sets from {@code app.analytics.zone}.
     */
    @Query("SELECT new com.structo.shortener.dto.DailyCount(cast(c.clickedAt as LocalDate), COUNT(c)) " +
            "FROM ClickEvent c WHERE c.shortLink.id = :linkId " +
            "GROUP BY cast(c.clickedAt as LocalDate) ORDER BY cast(c.clickedAt as LocalDate)")
    List<DailyCount> countClicksByDay(@Param("linkId") UUID linkId);

    @Query("SELECT new com.structo.shortener.dto.NamedCount(c.country, COUNT(c)) FROM ClickEvent c " +
            "WHERE c.shortLink.id = :linkId AND c.country <> '' " +
            "GROUP BY c.country ORDER BY COUNT(c) DESC, c.country ASC")
    List<NamedCount> topCountries(@Param("linkId") UUID linkId, Pageable page);

    @Query("SELECT new com.structo.shortener.dto.NamedCount(c.browser, COUNT(c)) FROM ClickEvent c " +
            "WHERE c.shortLink.id = :linkId AND c.browser <> '' " +
            "GROUP BY c.browser ORDER BY COUNT(c) DESC, c.browser ASC")
    List<NamedCount> topBrowsers(@Param("linkId") UUID linkId, Pageable page);

    @Query("SELECT new com.structo.shortener.dto.NamedCount(c.os, COUNT(c)) FROM ClickEvent c " +
            "WHERE c.shortLink.id = :linkId AND c.os <> '' " +
            "GROUP BY c.os ORDER BY COUNT(c) DESC, c.os ASC")
    List<NamedCount> topOperatingSystems(@Param("linkId") UUID linkId, Pageable page);

    @Query("SELECT new com.structo.shortener.dto.NamedCount(c.referrer, COUNT(c)) FROM ClickEvent c " +
            "WHERE c.shortLink.id = :linkId AND c.referrer <> '' " +
            "GROUP BY c.referrer ORDER BY COUNT(c) DESC, c.referrer ASC")
    List<NamedCount> topReferrers(@Param("linkId") UUID linkId, Pageable page);

    @Query("SELECT c.deviceType, COUNT(c) FROM ClickEvent c WHERE c.shortLink.id = :linkId " +
            "GROUP BY c.deviceType ORDER BY COUNT(c) DESC, c.deviceType ASC")
    List<Object[]> countByDeviceType(@Param("linkId") UUID linkId);
}
