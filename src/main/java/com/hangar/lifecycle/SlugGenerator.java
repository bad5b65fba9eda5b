package com.hangar.lifecycle;

import com.hangar.core.error.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives and validates URL-safe project slugs.
 */
public final class SlugGenerator {

    public static final int MAX_LENGTH = 30;

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern VALID = Pattern.compile("^[a-z0-9-]+$");

    private SlugGenerator() {}

    /**
     * {@code "Acme Corp!"} becomes {@code "acme-corp"}.
     *
     * @throws ValidationException if nothing usable remains
     */
    public static String fromName(String name) {
        String slug = NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = trimHyphens(slug);
        if (slug.length() > MAX_LENGTH) {
            slug = trimHyphens(slug.substring(0, MAX_LENGTH));
        }
        if (slug.isEmpty()) {
            throw new ValidationException("Cannot derive a slug from name '" + name + "'; supply one explicitly");
        }
        return slug;
    }

    public static void validate(String slug) {
        if (slug == null || slug.isEmpty() || slug.length() > MAX_LENGTH || !VALID.matcher(slug).matches()) {
            throw new ValidationException("Invalid slug '" + slug + "': use 1-" + MAX_LENGTH
                    + " lowercase letters, digits or hyphens");
        }
    }

    private static String trimHyphens(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        return s.substring(start, end);
    }
}
