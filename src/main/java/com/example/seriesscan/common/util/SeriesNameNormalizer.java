package com.example.seriesscan.common.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical comparison key for series titles: lower-cased, with everything but letters,
 * ASCII digits and {@code +} removed. Results are never cached; callers normalize at
 * every comparison because record fields may be rewritten between comparisons.
 */
public final class SeriesNameNormalizer {

    private static final Pattern NON_KEY_CHARS = Pattern.compile("[^\\p{L}0-9+]");

    private SeriesNameNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return NON_KEY_CHARS.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
