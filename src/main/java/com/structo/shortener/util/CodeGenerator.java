package com.structo.shortener.util;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Random short codes over an alphabet without look-alike glyphs (no 0, 1, i, l, o).
 */
@Component
public class CodeGenerator {

    public static final String ALPHABET = "23456789abcdefghjkmnpqrstuvwxyz";

    private final SecureRandom random = new SecureRandom();

    public String generate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Code length must be positive: " + length);
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
