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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShorteningServiceTest {

    private static final String URL = "https://example.com/long-path";

    @Mock
    private ShortLinkRegistry shortLinkRegistry;

    @Mock
    private CodeGenerator codeGenerator;

    @Mock
    private ShortenerMetrics metrics;

    @InjectMocks
    private ShorteningService shorteningService;

    private AppUser owner;

    @BeforeEach
    void setUp() {
        owner = new AppUser();
        owner.setId(42L);
    }

    private static ShortLink link(String code, boolean custom) {
        ShortLink link = new ShortLink();
        link.setShortCode(code);
        link.setOriginalUrl(URL);
        link.setCustomCode(custom);
        return link;
    }

    @Test
    @DisplayName("create: generated code of the base length on the first attempt")
    void create_generatedCode_firstAttempt() {
        when(codeGenerator.generate(7)).thenReturn("abcdefg");
        when(shortLinkRegistry.insert(URL, "abcdefg", false, null, null)).thenReturn(link("abcdefg", false));

        ShortLink result = shorteningService.create(URL, null, null);

        assertThat(result.getShortCode()).isEqualTo("abcdefg");
        verify(codeGenerator).generate(7);
        verify(metrics).linkCreated();
        verify(metrics, never()).codeCollision();
    }

    @Test
    @DisplayName("create: a collision is retried with a code one character longer")
    void create_collision_retriesWithLongerCode() {
        when(codeGenerator.generate(7)).thenReturn("taken22");
        when(codeGenerator.generate(8)).thenReturn("fresh234");
        when(shortLinkRegistry.insert(URL, "taken22", false, null, null))
                .thenThrow(new DuplicateCodeException("taken22", null));
        when(shortLinkRegistry.insert(URL, "fresh234", false, null, null)).thenReturn(link("fresh234", false));

        ShortLink result = shorteningService.create(URL, null, null);

        assertThat(result.getShortCode()).isEqualTo("fresh234");
        InOrder order = inOrder(codeGenerator);
        order.verify(codeGenerator).generate(7);
        order.verify(codeGenerator).generate(8);
        verify(metrics).codeCollision();
    }

    @Test
    @DisplayName("create: gives up after five collisions, lengths 7 through 11")
    void create_exhaustsRetries() {
        when(codeGenerator.generate(anyInt())).thenAnswer(inv -> "x".repeat(inv.getArgument(0)));
        when(shortLinkRegistry.insert(eq(URL), anyString(), eq(false), isNull(), isNull()))
                .thenAnswer(inv -> {
                    throw new DuplicateCodeException(inv.getArgument(1), null);
                });

        assertThatThrownBy(() -> shorteningService.create(URL, null, null))
                .isInstanceOf(ExhaustedRetriesException.class);

        InOrder order = inOrder(codeGenerator);
        for (int length = 7; length <= 11; length++) {
            order.verify(codeGenerator).generate(length);
        }
        verify(codeGenerator, times(5)).generate(anyInt());
        verify(metrics, times(5)).codeCollision();
        verify(metrics, never()).linkCreated();
    }

    @Test
    @DisplayName("create: custom code is trimmed and lowercased before insert")
    void create_customCode_normalized() {
        when(shortLinkRegistry.insert(URL, "my-brand", true, owner, null)).thenReturn(link("my-brand", true));

        ShortLink result = shorteningService.create(URL, owner, "  My-Brand ");

        assertThat(result.getShortCode()).isEqualTo("my-brand");
        assertThat(result.isCustomCode()).isTrue();
        verifyNoInteractions(codeGenerator);
    }

    @Test
    @DisplayName("create: a whitespace-only custom code is validated, not replaced by a generated one")
    void create_customCode_whitespaceOnly() {
        assertThatThrownBy(() -> shorteningService.create(URL, owner, "   "))
                .isInstanceOf(InvalidCodeException.class);

        verifyNoInteractions(codeGenerator, shortLinkRegistry);
    }

    @Test
    @DisplayName("create: invalid custom code is rejected without touching the store")
    void create_customCode_invalid() {
        assertThatThrownBy(() -> shorteningService.create(URL, owner, "ab@c"))
                .isInstanceOf(InvalidCodeException.class);

        verifyNoInteractions(shortLinkRegistry);
    }

    @Test
    @DisplayName("create: taken custom code is a conflict and is never retried")
    void create_customCode_taken() {
        when(shortLinkRegistry.insert(URL, "taken", true, owner, null))
                .thenThrow(new DuplicateCodeException("taken", null));

        assertThatThrownBy(() -> shorteningService.create(URL, owner, "taken"))
                .isInstanceOf(CodeAlreadyExistsException.class)
                .hasMessageContaining("taken");

        verify(shortLinkRegistry, times(1)).insert(anyString(), anyString(), anyBoolean(), any(), any());
        verifyNoInteractions(codeGenerator);
    }

    @Test
    @DisplayName("create: malformed URL is rejected")
    void create_invalidUrl() {
        assertThatThrownBy(() -> shorteningService.create("not a url", null, null))
                .isInstanceOf(InvalidUrlException.class);
        assertThatThrownBy(() -> shorteningService.create(null, null, null))
                .isInstanceOf(InvalidUrlException.class);

        verifyNoInteractions(shortLinkRegistry, codeGenerator);
    }

    @Test
    @DisplayName("create: expiry is passed through to the registry")
    void create_withExpiry() {
        Instant expiresAt = Instant.parse("2030-01-01T00:00:00Z");
        when(codeGenerator.generate(7)).thenReturn("abcdefg");
        when(shortLinkRegistry.insert(URL, "abcdefg", false, owner, expiresAt)).thenReturn(link("abcdefg", false));

        shorteningService.create(URL, owner, null, expiresAt);

        verify(shortLinkRegistry).insert(URL, "abcdefg", false, owner, expiresAt);
    }
}
