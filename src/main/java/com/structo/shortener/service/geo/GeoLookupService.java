package com.structo.shortener.service.geo;

import com.structo.shortener.model.GeoLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Best-effort enrichment boundary. Never throws: malformed addresses, provider errors and misses
 * all come back as {@link GeoLocation#unknown()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeoLookupService {

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]+$");

    private final GeoLocator geoLocator;

    public GeoLocation lookup(String ipAddress) {
        if (!isIpAddress(ipAddress)) {
            return GeoLocation.unknown();
        }
        try {
            GeoLocation location = geoLocator.locate(ipAddress);
            return location != null ? location : GeoLocation.unknown();
        } catch (RuntimeException e) {
            log.debug("Geo lookup failed for {}: {}", ipAddress, e.getMessage());
            return GeoLocation.unknown();
        }
    }

    static boolean isIpAddress(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        return IPV4.matcher(value).matches() || (value.contains(":") && IPV6.matcher(value).matches());
    }
}
