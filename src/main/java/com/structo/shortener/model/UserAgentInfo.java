package com.structo.shortener.model;

import lombok.Value;

/**
 * Browser, OS and device class extracted from a User-Agent header. Fields are never null.
 */
@Value
public class UserAgentInfo {
    private static final UserAgentInfo EMPTY = new UserAgentInfo("", "", "", "", DeviceType.UNKNOWN);

    String browser;
    String browserVersion;
    String os;
    String osVersion;
    DeviceType deviceType;

    public static UserAgentInfo empty() {
        return EMPTY;
    }
}
