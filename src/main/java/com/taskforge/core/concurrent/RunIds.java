package com.taskforge.core.concurrent;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates {@code <prefix>_<epochMillis>_<random>} identifiers.
 */
public final class RunIds {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private RunIds() {}

    public static String next(String prefix, Clock clock) {
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return prefix + "_" + clock.millis() + "_" + suffix;
    }
}
