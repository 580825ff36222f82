package com.structo.shortener.service;

import com.structo.shortener.dto.LinkAnalyticsResponse;
import com.structo.shortener.dto.NamedCount;
import com.structo.shortener.model.DeviceType;
import com.structo.shortener.model.ShortLink;
import com.structo.shortener.repository.ClickEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Per-link click summaries, recomputed from the event log on every call.
 */
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private final ClickEventRepository clickEventRepository;
    private final ShortLinkService shortLinkService;

    @Value("${app.analytics.top-n:10}")
    private int topN = 10;

    public LinkAnalyticsResponse summarizeOwned(String code, Long userId) {
        return summarize(shortLinkService.findOwned(code, userId));
    }

    @Transactional(readOnly = true)
    public LinkAnalyticsResponse summarize(ShortLink link) {
        UUID id = link.getId();
        Pageable top = PageRequest.of(0, topN);
        return LinkAnalyticsResponse.builder()
                .shortCode(link.getShortCode())
                .originalUrl(link.getOriginalUrl())
                .totalClicks(link.getClickCount())
                .uniqueVisitors(clickEventRepository.countDistinctIpAddresses(id))
                .clicksByDay(clickEventRepository.countClicksByDay(id))
                .topCountries(clickEventRepository.topCountries(id, top))
                .topBrowsers(clickEventRepository.topBrowsers(id, top))
                .topOs(clickEventRepository.topOperatingSystems(id, top))
                .topReferrers(clickEventRepository.topReferrers(id, top))
                .topDevices(deviceBreakdown(id))
                .build();
    }

    public List<NamedCount> deviceBreakdown(UUID linkId) {
        return clickEventRepository.countByDeviceType(linkId).stream()
                .map(row -> new NamedCount(((DeviceType) row[0]).getValue(), (Long) row[1]))
                .collect(Collectors.toList());
    }
}
