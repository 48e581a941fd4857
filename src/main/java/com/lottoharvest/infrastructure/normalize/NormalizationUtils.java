package com.lottoharvest.infrastructure.normalize;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Utilities for cleaning scraped cell text and comparing it against alias tables.
 */
public class NormalizationUtils {

    /**
     * Cleans display text.
     *
     * Rules:
     * 1. Compatibility-normalize (full-width digits and letters become ASCII)
     * 2. Turn non-breaking spaces into spaces
     * 3. Collapse whitespace runs and trim
     */
    public static String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = Normalizer.normalize(text, Normalizer.Form.NFKC);
        cleaned = cleaned.replace('\u00A0', ' ');
        cleaned = cleaned.replaceAll("\\s+", " ");
        return cleaned.strip();
    }

    /**
     * Normalizes one token for alias lookups.
     *
     * Rules:
     * 1. Clean as {@link #cleanText(String)}
     * 2. Remove accents, keeping Hangul syllables composed
     * 3. Convert to uppercase
     * 4. Replace anything but letters and digits with underscore
     * 5. Collapse underscores and strip them from both ends
     */
    public static String normalizeToken(String text) {
        String cleaned = cleanText(text);
        if (cleaned.isEmpty()) {
            return "";
        }

        // Remove accents
        String normalized = Normalizer.normalize(cleaned, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = Normalizer.normalize(normalized, Normalizer.Form.NFC);

        normalized = normalized.toUpperCase(Locale.ROOT);
        normalized = normalized.replaceAll("[^\\p{L}\\p{N}]+", "_");
        normalized = normalized.replaceAll("_+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");

        return normalized;
    }

    /**
     * Reads the digits of a money or count cell ("2,345,678원" is 2345678).
     * Returns 0 when there are none.
     */
    public static long digitsOnly(String text) {
        if (text == null) {
            return 0L;
        }
        String digits = text.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            return 0L;
        }
        if (digits.length() > 18) {
            throw new NumberFormatException("Too many digits in '" + text + "'");
        }
        return Long.parseLong(digits);
    }
}
