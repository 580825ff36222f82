package com.structo.shortener.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Syntax check for redirect targets: absolute http/https URL, a dotted host name, {@code localhost} or an
 * IP literal, no embedded credentials, at most {@code maxLen} characters. No reachability or DNS checks.
 */
public final class UrlValidator {

    private static final Set<String> SCHEMES = Set.of("http", "https");

    private UrlValidator() {
    }

    public static boolean isValidHttpUrl(String url, int maxLen) {
        if (url == null) {
            return false;
        }
        String candidate = url.trim();
        if (candidate.isEmpty() || candidate.length() > maxLen) {
            return false;
        }

        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            return false;
        }
        if (uri.getScheme() == null || !SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            return false;
        }
        // no embedded credentials
        if (uri.getRawUserInfo() != null) {
            return false;
        }
        if (uri.getPort() > 65535) {
            return false;
        }
        return isAcceptableHost(uri.getHost());
    }

    private static boolean isAcceptableHost(String host) {
        if (host == null || host.isEmpty()) {
            return false;
        }
        if (host.startsWith("[") || host.equalsIgnoreCase("localhost")) {
            return true;
        }
        int dot = host.indexOf('.');
        return dot > 0 && dot < host.length() - 1;
    }
}
