package com.lottoharvest.domain.model;

import java.util.Locale;

/**
 * Identity of a record within one run; a record seen on an earlier page of the
 * same section has the same key.
 */
public record DedupKey(int round, Tier tier, String label, String location) {

    public static DedupKey of(int round, Tier tier, String label, String location) {
        return new DedupKey(round, tier, canonical(label), canonical(location));
    }

    private static String canonical(String text) {
        if (text == null) {
            return "";
        }
        return text.strip().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
