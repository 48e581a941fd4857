package com.lottoharvest.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * Header vocabulary used to recognize store tables and header-shaped rows.
 */
public final class HeaderKeywords {

    public static final List<String> NAME = List.of("상호", "판매점", "store", "name");
    public static final List<String> ADDRESS = List.of("소재지", "주소", "address", "location");
    public static final List<String> CLASSIFICATION = List.of("구분", "method");

    private HeaderKeywords() {
    }

    public static boolean containsAny(String text, List<String> keywords) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /** A row or header line naming both the store and the address column. */
    public static boolean isHeaderSignature(String text) {
        return containsAny(text, NAME) && containsAny(text, ADDRESS);
    }
}
