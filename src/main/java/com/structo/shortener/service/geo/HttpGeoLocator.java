package com.structo.shortener.service.geo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.structo.shortener.model.GeoLocation;
import lombok.Data;
import org.springframework.web.client.RestTemplate;

/**
 * Looks addresses up against an ip-api style JSON endpoint. {@code urlTemplate} carries a single
 * {@code {ip}} placeholder, e.g. {@code http://ip-api.com/json/{ip}?fields=status,countryCode,city}.
 */
public class HttpGeoLocator implements GeoLocator {

    private final RestTemplate restTemplate;
    private final String urlTemplate;

    public HttpGeoLocator(RestTemplate restTemplate, String urlTemplate) {
        this.restTemplate = restTemplate;
        this.urlTemplate = urlTemplate;
    }

    @Override
    public GeoLocation locate(String ipAddress) {
        LookupResponse response = restTemplate.getForObject(urlTemplate, LookupResponse.class, ipAddress);
        if (response == null || !"success".equalsIgnoreCase(response.getStatus())) {
            return GeoLocation.unknown();
        }
        return GeoLocation.of(response.getCountryCode(), response.getCity());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LookupResponse {
        private String status;
        private String countryCode;
        private String city;
    }
}
