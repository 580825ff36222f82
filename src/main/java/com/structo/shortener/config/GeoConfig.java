package com.structo.shortener.config;

import com.structo.shortener.service.geo.GeoLocator;
import com.structo.shortener.service.geo.HttpGeoLocator;
import com.structo.shortener.service.geo.NoopGeoLocator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class GeoConfig {

    @Bean
    @ConditionalOnProperty(name = "app.geo.provider", havingValue = "http")
    public GeoLocator httpGeoLocator(RestTemplateBuilder builder,
                                     @Value("${app.geo.url}") String url,
                                     @Value("${app.geo.timeout-millis:500}") long timeoutMillis) {
        return new HttpGeoLocator(builder
                .connectTimeout(Duration.ofMillis(timeoutMillis))
                .readTimeout(Duration.ofMillis(timeoutMillis))
                .build(), url);
    }

    @Bean
    @ConditionalOnMissingBean(GeoLocator.class)
    public GeoLocator noopGeoLocator() {
        return new NoopGeoLocator();
    }
}
