package com.structo.shortener.service;

import com.structo.shortener.config.AsyncConfig;
import com.structo.shortener.model.ClientInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Hands click recording to the click executor so the redirect response does not wait for it.
 * Failures are logged by the async exception handler in {@link AsyncConfig}.
 */
@Service
@RequiredArgsConstructor
public class AsyncClickRecorder {

    private final ClickIngestor clickIngestor;
    private final ShortLinkRegistry shortLinkRegistry;

    @Async(AsyncConfig.CLICK_EXECUTOR)
    public void record(ClientInfo client, UUID shortLinkId) {
        clickIngestor.record(client, shortLinkRegistry.reference(shortLinkId));
    }
}
