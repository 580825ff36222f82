package com.structo.shortener.service;

import com.structo.shortener.repository.ShortLinkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Brings lagging click counters back in line with the event log. Disabled unless
 * {@code app.clicks.reconcile-cron} is set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClickCountReconciler {

    private final ShortLinkRepository shortLinkRepository;

    @Scheduled(cron = "${app.clicks.reconcile-cron:-}")
    public int reconcile() {
        int updated = shortLinkRepository.reconcileClickCounts();
        if (updated > 0) {
            log.info("Reconciled click counters for {} short links", updated);
        }
        return updated;
    }
}
