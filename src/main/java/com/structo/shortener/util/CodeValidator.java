package com.structo.shortener.util;

import java.util.Locale;

/**
 * Syntax rules for user-chosen short codes: 3 to 20 characters of lowercase letters, digits and
 * hyphens, not starting or ending with a hyphen. Case is folded before the character check.
 */
public final class CodeValidator {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 20;

    private CodeValidator() {
    }

    public static boolean isValidCustomCode(String code) {
        if (code == null || code.length() < MIN_LENGTH || code.length() > MAX_LENGTH) {
            return false;
        }
        if (code.startsWith("-") || code.endsWith("-")) {
            return false;
        }
        String folded = code.toLowerCase(Locale.ROOT);
        for (int i = 0; i < folded.length(); i++) {
            char c = folded.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }
}
