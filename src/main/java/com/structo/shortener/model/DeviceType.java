package com.structo.shortener.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DeviceType {
    MOBILE("mobile"),
    TABLET("tablet"),
    DESKTOP("desktop"),
    BOT("bot"),
    UNKNOWN("unknown");

    private final String value;

    DeviceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static DeviceType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
