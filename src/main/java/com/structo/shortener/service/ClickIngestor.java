package com.structo.shortener.service;

import com.structo.shortener.model.ClickEvent;
import com.structo.shortener.model.ClientInfo;
import com.structo.shortener.model.GeoLocation;
import com.structo.shortener.model.ShortLink;
import com.structo.shortener.model.UserAgentInfo;
import com.structo.shortener.monitoring.ShortenerMetrics;
import com.structo.shortener.repository.ClickEventRepository;
import com.structo.shortener.service.geo.GeoLookupService;
import com.structo.shortener.util.UserAgentParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Writes one {@link ClickEvent} per redirect and bumps the link's counter.
 *
 * <p>The event row is the record of truth and is written first. The counter increment is a
 * separate statement; if it fails the drift is logged and later repaired by
 * {@link ClickCountReconciler}. Enrichment never fails a click: unknown data is stored as empty.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClickIngestor {

    private static final int MAX_REFERRER_LENGTH = ShortLink.MAX_URL_LENGTH;
    private static final int MAX_IP_LENGTH = 45;

    private final ClickEventRepository clickEventRepository;
    private final ShortLinkRegistry shortLinkRegistry;
    private final GeoLookupService geoLookupService;
    private final ShortenerMetrics metrics;
    private final Clock clock;

    public ClickEvent record(ClientInfo client, ShortLink shortLink) {
        return record(client.getIpAddress(), client.getUserAgent(), client.getReferrer(), shortLink);
    }

    public ClickEvent record(String clientIp, String userAgent, String referrer, ShortLink shortLink) {
        String ip = truncate(clientIp, MAX_IP_LENGTH);
        String ua = userAgent == null ? "" : userAgent;
        UserAgentInfo agent = UserAgentParser.parse(ua);
        GeoLocation geo = geoLookupService.lookup(ip);

        ClickEvent event = new ClickEvent();
        event.setShortLink(shortLink);
        event.setClickedAt(clock.instant());
        event.setIpAddress(ip);
        event.setCountry(geo.getCountry());
        event.setCity(geo.getCity());
        event.setBrowser(agent.getBrowser());
        event.setBrowserVersion(agent.getBrowserVersion());
        event.setOs(agent.getOs());
        event.setOsVersion(agent.getOsVersion());
        event.setDeviceType(agent.getDeviceType());
        event.setReferrer(truncate(referrer, MAX_REFERRER_LENGTH));
        event.setUserAgent(ua);
        ClickEvent saved = clickEventRepository.save(event);

        try {
            shortLinkRegistry.incrementClickCount(shortLink.getId());
        } catch (DataAccessException e) {
            log.warn("Click {} stored but counter increment failed for link {}; leaving it to reconciliation",
                    saved.getId(), shortLink.getId(), e);
        }
        metrics.clickRecorded();
        return saved;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
