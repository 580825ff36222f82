package com.structo.shortener.model;

import lombok.Value;

/**
 * Client signal captured from a redirect request before the request is released.
 */
@Value
public class ClientInfo {
    String ipAddress;
    String userAgent;
    String referrer;
}
