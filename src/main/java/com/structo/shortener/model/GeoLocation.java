package com.structo.shortener.model;

import lombok.Value;

@Value
public class GeoLocation {
    private static final GeoLocation UNKNOWN = new GeoLocation("", "");

    String country;
    String city;

    public static GeoLocation unknown() {
        return UNKNOWN;
    }

    public static GeoLocation of(String country, String city) {
        return new GeoLocation(truncate(country, 2), truncate(city, 100));
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.length() > max ? trimmed.substring(0, max) : trimmed;
    }
}
