package com.structo.shortener.monitoring;

import com.structo.shortener.repository.AppUserRepository;
import com.structo.shortener.repository.ClickEventRepository;
import com.structo.shortener.repository.ShortLinkRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class ShortenerMetrics {

    private final Counter linksCreated;
    private final Counter codeCollisions;
    private final Counter clicksRecorded;

    public ShortenerMetrics(MeterRegistry registry,
                            AppUserRepository userRepository,
                            ShortLinkRepository shortLinkRepository,
                            ClickEventRepository clickEventRepository) {

        Gauge.builder("app.users.total", userRepository::count)
             .description("Total number of registered users")
             .register(registry);

        Gauge.builder("app.links.total", shortLinkRepository::count)
             .description("Total number of short links, active or not")
             .register(registry);

        Gauge.builder("app.clicks.total", clickEventRepository::count)
             .description("Total number of recorded click events")
             .register(registry);

        linksCreated = Counter.builder("app.links.created")
                .description("Short links created since start")
                .register(registry);
        codeCollisions = Counter.builder("app.links.collisions")
                .description("Generated codes rejected by the unique constraint")
                .register(registry);
        clicksRecorded = Counter.builder("app.clicks.recorded")
                .description("Click events written since start")
                .register(registry);
    }

    public void linkCreated() {
        linksCreated.increment();
    }

    public void codeCollision() {
        codeCollisions.increment();
    }

    public void clickRecorded() {
        clicksRecorded.increment();
    }
}
