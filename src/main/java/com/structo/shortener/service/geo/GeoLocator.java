package com.structo.shortener.service.geo;

import com.structo.shortener.model.GeoLocation;

/**
 * Resolves an IP address to a country and city. Implementations may throw; callers go through
 * {@link GeoLookupService}, which turns any failure into {@link GeoLocation#unknown()}.
 */
public interface GeoLocator {
    GeoLocation locate(String ipAddress);
}
