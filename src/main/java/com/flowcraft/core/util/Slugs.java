package com.flowcraft.core.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * File-name friendly slugs for exported flow documents.
 */
public final class Slugs {
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private Slugs() {
        // Utility class
    }

    /**
     * Lower-cases the value, strips accents, replaces every run of characters
     * outside {@code [a-z0-9]} with a single dash and trims dashes. Returns
     * {@code fallback} when nothing is left.
     */
    public static String slugify(String value, String fallback) {
        if (value == null)
            return fallback;
        String ascii = DIACRITICS.matcher(Normalizer.normalize(value, Normalizer.Form.NFKD)).replaceAll("");
        String slug = NON_ALNUM.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
        int start = 0, end = slug.length();
        while (start < end && slug.charAt(start) == '-')
            start++;
        while (end > start && slug.charAt(end - 1) == '-')
            end--;
        slug = slug.substring(start, end);
        return slug.isEmpty() ? fallback : slug;
    }
}
