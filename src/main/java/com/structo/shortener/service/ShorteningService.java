package com.structo.shortener.service;

import com.structo.shortener.exception.CodeAlreadyExistsException;
import com.structo.shortener.exception.DuplicateCodeException;
import com.structo.shortener.exception.ExhaustedRetriesException;
import com.structo.shortener.exception.InvalidCodeException;
import com.structo.shortener.exception.InvalidUrlException;
import com.structo.shortener.model.AppUser;
import com.structo.shortener.model.ShortLink;
import com.structo.shortener.monitoring.ShortenerMetrics;
import com.structo.shortener.util.CodeGenerator;
import com.structo.shortener.util.CodeValidator;
import com.structo.shortener.util.UrlValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;

/**
 * Creates short links, either under a caller-chosen code or a generated one.
 *
 * <p>Generated codes start at {@code app.shortener.code-length} characters and grow by one on every
 * collision, for at most {@code app.shortener.max-retries} attempts. Custom codes are never retried.
 * Callers must reject anonymous custom-code requests before getting here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShorteningService {

    private final ShortLinkRegistry shortLinkRegistry;
    private final CodeGenerator codeGenerator;
    private final ShortenerMetrics metrics;

    @Value("${app.shortener.code-length:7}")
    private int codeLength = 7;

    @Value("${app.shortener.max-retries:5}")
    private int maxRetries = 5;

    public ShortLink create(String originalUrl, AppUser owner, String customCode) {
        return create(originalUrl, owner, customCode, null);
    }

    public ShortLink create(String originalUrl, AppUser owner, String customCode, Instant expiresAt) {
        String url = originalUrl == null ? null : originalUrl.trim();
        if (!UrlValidator.isValidHttpUrl(url, ShortLink.MAX_URL_LENGTH)) {
            throw new InvalidUrlException("Enter a valid http or https URL of at most "
                    + ShortLink.MAX_URL_LENGTH + " characters.");
        }

        ShortLink link = customCode != null && !customCode.isEmpty()
                ? createWithCustomCode(url, owner, customCode, expiresAt)
                : createWithGeneratedCode(url, owner, expiresAt);
        metrics.linkCreated();
        return link;
    }

    private ShortLink createWithCustomCode(String url, AppUser owner, String customCode, Instant expiresAt) {
        String code = customCode.trim().toLowerCase(Locale.ROOT);
        if (!CodeValidator.isValidCustomCode(code)) {
            throw new InvalidCodeException("Custom code must be 3-20 characters, alphanumeric and hyphens only, "
                    + "cannot start or end with a hyphen.");
        }
        try {
            return shortLinkRegistry.insert(url, code, true, owner, expiresAt);
        } catch (DuplicateCodeException e) {
            throw new CodeAlreadyExistsException(code);
        }
    }

    private ShortLink createWithGeneratedCode(String url, AppUser owner, Instant expiresAt) {
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            String code = codeGenerator.generate(codeLength + attempt);
            try {
                return shortLinkRegistry.insert(url, code, false, owner, expiresAt);
            } catch (DuplicateCodeException e) {
                metrics.codeCollision();
                log.warn("Short code collision on attempt {}: {}", attempt + 1, code);
            }
        }
        log.error("Gave up generating a short code after {} attempts", maxRetries);
        throw new ExhaustedRetriesException(maxRetries);
    }
}
