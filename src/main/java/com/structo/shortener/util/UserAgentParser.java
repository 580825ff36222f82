package com.structo.shortener.util;

import com.structo.shortener.model.DeviceType;
import com.structo.shortener.model.UserAgentInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic User-Agent classification.
 *
 * <p>Device class precedence is bot, mobile, tablet, desktop, unknown: the first heuristic that
 * matches wins. Parsing never throws; anything unexpected yields {@link UserAgentInfo#empty()}.
 */
@Slf4j
public final class UserAgentParser {

    private static final int MAX_NAME_LENGTH = 50;
    private static final int MAX_VERSION_LENGTH = 20;

    private static final Pattern BOT = Pattern.compile(
            "\\bbot\\b|[a-z]bot[/\\-;)]|crawl|spider|slurp|bingpreview|facebookexternalhit|mediapartners|headlesschrome"
                    + "|curl/|wget/|python-requests|python-urllib|java/|okhttp|go-http-client|apache-httpclient|libwww");
    private static final Pattern MOBILE = Pattern.compile(
            "iphone|ipod|windows phone|blackberry|bb10|opera mini|iemobile|android.*mobile");
    private static final Pattern TABLET = Pattern.compile(
            "ipad|tablet|kindle|silk/|playbook|android");
    private static final Pattern DESKTOP = Pattern.compile(
            "windows nt|macintosh|mac os x|x11|linux|\\bcros\\b");

    private static final Pattern BOT_NAME = Pattern.compile("([A-Za-z][\\w\\-]*?(?:bot|Bot|spider|Spider|crawler|Crawler))/(\\d+(?:\\.\\d+)*)");
    private static final Pattern TOOL_NAME = Pattern.compile("^([A-Za-z][\\w\\-]*)/(\\d+(?:\\.\\d+)*)");

    private static final Pattern EDGE = Pattern.compile("(?:Edg|Edge|EdgA|EdgiOS)/(\\d+(?:\\.\\d+)*)");
    private static final Pattern OPERA = Pattern.compile("(?:OPR|Opera)/(\\d+(?:\\.\\d+)*)");
    private static final Pattern SAMSUNG = Pattern.compile("SamsungBrowser/(\\d+(?:\\.\\d+)*)");
    private static final Pattern FIREFOX = Pattern.compile("(?:Firefox|FxiOS)/(\\d+(?:\\.\\d+)*)");
    private static final Pattern CHROME = Pattern.compile("(?:Chrome|CriOS)/(\\d+(?:\\.\\d+)*)");
    private static final Pattern SAFARI = Pattern.compile("Version/(\\d+(?:\\.\\d+)*).*Safari/");
    private static final Pattern IE = Pattern.compile("MSIE (\\d+(?:\\.\\d+)*)|Trident/.*rv:(\\d+(?:\\.\\d+)*)");

    private static final Pattern WINDOWS_PHONE = Pattern.compile("Windows Phone(?: OS)? (\\d+(?:\\.\\d+)*)");
    private static final Pattern WINDOWS = Pattern.compile("Windows NT (\\d+\\.\\d+)");
    private static final Pattern IOS = Pattern.compile("(?:iPhone|iPad|iPod).*?OS (\\d+)_(\\d+)(?:_(\\d+))?");
    private static final Pattern MAC = Pattern.compile("Mac OS X (\\d+)[_.](\\d+)(?:[_.](\\d+))?");
    private static final Pattern ANDROID = Pattern.compile("Android(?: (\\d+(?:\\.\\d+)*))?");

    private static final Map<String, String> WINDOWS_VERSIONS = Map.of(
            "10.0", "10",
            "6.3", "8.1",
            "6.2", "8",
            "6.1", "7",
            "6.0", "Vista",
            "5.1", "XP");

    private UserAgentParser() {
    }

    public static UserAgentInfo parse(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return UserAgentInfo.empty();
        }
        try {
            String[] browser = detectBrowser(userAgent);
            String[] os = detectOs(userAgent);
            return new UserAgentInfo(
                    truncate(browser[0], MAX_NAME_LENGTH),
                    truncate(browser[1], MAX_VERSION_LENGTH),
                    truncate(os[0], MAX_NAME_LENGTH),
                    truncate(os[1], MAX_VERSION_LENGTH),
                    classify(userAgent));
        } catch (RuntimeException e) {
            log.debug("Could not parse user agent '{}': {}", userAgent, e.getMessage());
            return UserAgentInfo.empty();
        }
    }

    public static DeviceType classify(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DeviceType.UNKNOWN;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (BOT.matcher(ua).find()) {
            return DeviceType.BOT;
        }
        if (MOBILE.matcher(ua).find() || (ua.contains("mobi") && !ua.contains("ipad"))) {
            return DeviceType.MOBILE;
        }
        if (TABLET.matcher(ua).find()) {
            return DeviceType.TABLET;
        }
        if (DESKTOP.matcher(ua).find()) {
            return DeviceType.DESKTOP;
        }
        return DeviceType.UNKNOWN;
    }

    private static String[] detectBrowser(String ua) {
        Matcher m;
        if ((m = BOT_NAME.matcher(ua)).find()) {
            return pair(m.group(1), m.group(2));
        }
        if ((m = EDGE.matcher(ua)).find()) {
            return pair("Edge", m.group(1));
        }
        if ((m = OPERA.matcher(ua)).find()) {
            return pair("Opera", m.group(1));
        }
        if ((m = SAMSUNG.matcher(ua)).find()) {
            return pair("Samsung Internet", m.group(1));
        }
        if ((m = FIREFOX.matcher(ua)).find()) {
            return pair("Firefox", m.group(1));
        }
        if ((m = CHROME.matcher(ua)).find()) {
            return pair("Chrome", m.group(1));
        }
        if ((m = SAFARI.matcher(ua)).find()) {
            return pair(ua.contains("Mobile") ? "Mobile Safari" : "Safari", m.group(1));
        }
        if ((m = IE.matcher(ua)).find()) {
            return pair("IE", m.group(1) != null ? m.group(1) : m.group(2));
        }
        if ((m = TOOL_NAME.matcher(ua)).find() && !"Mozilla".equals(m.group(1))) {
            return pair(m.group(1), m.group(2));
        }
        return pair("", "");
    }

    private static String[] detectOs(String ua) {
        Matcher m;
        if ((m = WINDOWS_PHONE.matcher(ua)).find()) {
            return pair("Windows Phone", m.group(1));
        }
        if ((m = WINDOWS.matcher(ua)).find()) {
            return pair("Windows", WINDOWS_VERSIONS.getOrDefault(m.group(1), m.group(1)));
        }
        if ((m = IOS.matcher(ua)).find()) {
            return pair("iOS", dotted(m.group(1), m.group(2), m.group(3)));
        }
        if ((m = MAC.matcher(ua)).find()) {
            return pair("Mac OS X", dotted(m.group(1), m.group(2), m.group(3)));
        }
        if ((m = ANDROID.matcher(ua)).find()) {
            return pair("Android", m.group(1));
        }
        if (ua.contains("CrOS")) {
            return pair("Chrome OS", "");
        }
        if (ua.contains("Ubuntu")) {
            return pair("Ubuntu", "");
        }
        if (ua.contains("Linux") || ua.contains("X11")) {
            return pair("Linux", "");
        }
        return pair("", "");
    }

    private static String dotted(String major, String minor, String patch) {
        return patch == null ? major + "." + minor : major + "." + minor + "." + patch;
    }

    private static String[] pair(String name, String version) {
        return new String[]{name == null ? "" : name, version == null ? "" : version};
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }
}
