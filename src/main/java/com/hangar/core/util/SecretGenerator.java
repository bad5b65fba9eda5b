package com.hangar.core.util;

import java.security.SecureRandom;

/**
 * Random secrets for container encryption keys and admin passwords.
 */
public final class SecretGenerator {

    private static final String ALPHANUMERIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    // No 0/O, 1/l/I so passwords survive being read aloud or retyped
    private static final String PASSWORD_ALPHABET =
            "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghjkmnpqrstuvwxyz23456789!@#$%^&*";

    private static final SecureRandom RANDOM = new SecureRandom();

    private SecretGenerator() {}

    public static String alphanumeric(int length) {
        return randomString(ALPHANUMERIC, length);
    }

    public static String password(int length) {
        return randomString(PASSWORD_ALPHABET, length);
    }

    public static String password() {
        return password(16);
    }

    private static String randomString(String alphabet, int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive, was " + length);
        }
        var sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(RANDOM.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
