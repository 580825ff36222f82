package com.structo.shortener.util;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Picks the client address for a request. The first X-Forwarded-For entry wins when present; the
 * header is trusted as set by the edge proxy.
 */
public final class ClientIpResolver {

    public static final String FORWARDED_FOR = "X-Forwarded-For";

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        return resolve(request.getHeader(FORWARDED_FOR), request.getRemoteAddr());
    }

    public static String resolve(String forwardedFor, String remoteAddr) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return remoteAddr == null || remoteAddr.isBlank() ? "0.0.0.0" : remoteAddr;
    }
}
