package com.structo.shortener;

import com.structo.shortener.exception.CodeAlreadyExistsException;
import com.structo.shortener.exception.DuplicateCodeException;
import com.structo.shortener.model.AppUser;
import com.structo.shortener.model.ShortLink;
import com.structo.shortener.monitoring.ShortenerMetrics;
import com.structo.shortener.repository.AppUserRepository;
import com.structo.shortener.repository.ClickEventRepository;
import com.structo.shortener.repository.ShortLinkRepository;
import com.structo.shortener.service.ClickCountReconciler;
import com.structo.shortener.service.ClickIngestor;
import com.structo.shortener.service.ShortLinkRegistry;
import com.structo.shortener.service.ShortLinkService;
import com.structo.shortener.service.ShorteningService;
import com.structo.shortener.util.CodeGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class ShortenerIntegrationTest {

    private static final String URL = "https://example.com/some/very/long/path";

    @Autowired
    private ShortLinkService shortLinkService;

    @Autowired
    private ShorteningService shorteningService;

    @Autowired
    private ShortLinkRegistry shortLinkRegistry;

    @Autowired
    private ClickIngestor clickIngestor;

    @Autowired
    private ClickCountReconciler reconciler;

    @Autowired
    private ShortenerMetrics metrics;

    @Autowired
    private ShortLinkRepository shortLinkRepository;

    @Autowired
    private ClickEventRepository clickEventRepository;

    @Autowired
    private AppUserRepository userRepository;

    private AppUser owner;

    @BeforeEach
    void setUp() {
        owner = new AppUser();
        owner.setName("Owner");
        owner.setEmail("owner@example.com");
        owner.setPasswordHash("hash");
        owner = userRepository.save(owner);
    }

    @AfterEach
    void tearDown() {
        clickEventRepository.deleteAll();
        shortLinkRepository.deleteAll();
        userRepository.deleteAll();
    }

    private long storedClickCount(ShortLink link) {
        return shortLinkRepository.findById(link.getId()).orElseThrow().getClickCount();
    }

    @Test
    @DisplayName("shorten, resolve and record a click end to end")
    void shortenResolveAndClick() {
        ShortLink link = shortLinkService.shorten(URL, null, null, null);

        assertThat(link.getShortCode()).hasSize(7);
        assertThat(link.getShortCode().chars()).allMatch(c -> CodeGenerator.ALPHABET.indexOf(c) >= 0);
        assertThat(link.getClickCount()).isZero();
        assertThat(link.isCustomCode()).isFalse();

        ShortLink resolved = shortLinkService.resolveForRedirect(link.getShortCode()).orElseThrow();
        assertThat(resolved.getOriginalUrl()).isEqualTo(URL);

        clickIngestor.record("192.168.1.1", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36", "", resolved);

        assertThat(storedClickCount(link)).isEqualTo(1);
        assertThat(clickEventRepository.countByShortLinkId(link.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("a taken custom code is rejected and the first link is untouched")
    void customCodeConflict() {
        ShortLink first = shortLinkService.shorten(URL, "My-Code", null, owner);
        assertThat(first.getShortCode()).isEqualTo("my-code");

        assertThatThrownBy(() -> shortLinkService.shorten("https://other.example", "my-code", null, owner))
                .isInstanceOf(CodeAlreadyExistsException.class);

        ShortLink stored = shortLinkRepository.findByShortCode("my-code").orElseThrow();
        assertThat(stored.getOriginalUrl()).isEqualTo(URL);
        assertThat(shortLinkRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("the store reports duplicate codes distinctly")
    void duplicateInsertIsDetectedByStore() {
        shortLinkRegistry.insert(URL, "dup2345", false, null);

        assertThatThrownBy(() -> shortLinkRegistry.insert("https://other.example", "dup2345", false, null))
                .isInstanceOf(DuplicateCodeException.class);
    }

    @Test
    @DisplayName("a colliding generated code is retried with a longer one")
    void generatedCodeCollisionRetries() {
        shortLinkRegistry.insert(URL, "aaaaaaa", false, null);
        CodeGenerator stubGenerator = new CodeGenerator() {
            @Override
            public String generate(int length) {
                return "a".repeat(length);
            }
        };
        ShorteningService service = new ShorteningService(shortLinkRegistry, stubGenerator, metrics);

        ShortLink link = service.create("https://other.example", null, null);

        assertThat(link.getShortCode()).isEqualTo("aaaaaaaa");
    }

    @Test
    @DisplayName("concurrent clicks are all counted")
    void concurrentClicksAreNotLost() throws Exception {
        ShortLink link = shorteningService.create(URL, owner, null);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String ip = "10.0.0." + (i % 50);
                futures.add(pool.submit(() -> clickIngestor.record(ip, "", "", link)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        assertThat(storedClickCount(link)).isEqualTo(100);
        assertThat(clickEventRepository.countByShortLinkId(link.getId())).isEqualTo(100);
    }

    @Test
    @DisplayName("deactivation is idempotent and stops resolution")
    void deactivateTwice() {
        ShortLink link = shortLinkService.shorten(URL, null, null, owner);

        shortLinkService.deactivate(link.getShortCode(), owner.getId());
        shortLinkService.deactivate(link.getShortCode(), owner.getId());

        assertThat(shortLinkService.resolveForRedirect(link.getShortCode())).isEmpty();
        assertThat(shortLinkService.findVisible(link.getShortCode(), owner.getId()).isActive()).isFalse();
        assertThat(shortLinkRepository.findByShortCode(link.getShortCode())).isPresent();
    }

    @Test
    @DisplayName("reconciliation repairs counters that missed increments")
    void reconcileRepairsDrift() {
        ShortLink link = shorteningService.create(URL, owner, null);
        clickIngestor.record("10.0.0.1", "", "", link);
        clickIngestor.record("10.0.0.2", "", "", link);
        ShortLink stored = shortLinkRepository.findById(link.getId()).orElseThrow();
        stored.setClickCount(0);
        shortLinkRepository.save(stored);

        assertThat(reconciler.reconcile()).isEqualTo(1);
        assertThat(storedClickCount(link)).isEqualTo(2);
        assertThat(reconciler.reconcile()).isZero();
    }
}
