package com.lottoharvest.infrastructure.normalize;

import com.lottoharvest.domain.model.StructuredRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the administrative region out of a free-text address.
 *
 * <p>The leading token decides when it names a region, either exactly or as a prefix
 * ("서울시" starts with "서울"). Otherwise any whole token naming a region is used, then
 * any long-form name found inside the text. The sub-region is the token following the
 * region token. Text naming no region resolves to {@link StructuredRecord#UNCLASSIFIED};
 * this never fails.
 */
public class RegionResolver {

    /** Aliases shorter than this are only matched as whole tokens. */
    private static final int MIN_SUBSTRING_ALIAS = 3;

    private final Map<String, String> aliasToCode = new LinkedHashMap<>();
    private final List<String> aliasesLongestFirst;

    public RegionResolver(List<RegionDefinition> regions) {
        for (RegionDefinition region : regions) {
            for (String alias : region.aliases()) {
                String key = NormalizationUtils.normalizeToken(alias);
                if (!key.isEmpty()) {
                    aliasToCode.putIfAbsent(key, region.code());
                }
            }
        }
        List<String> sorted = new ArrayList<>(aliasToCode.keySet());
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.aliasesLongestFirst = List.copyOf(sorted);
    }

    public Resolution resolve(String locationText) {
        String cleaned = NormalizationUtils.cleanText(locationText);
        if (cleaned.isEmpty()) {
            return Resolution.UNCLASSIFIED;
        }
        String[] tokens = cleaned.split(" ");

        // 1. Leading token
        String code = lookup(NormalizationUtils.normalizeToken(tokens[0]), true);
        if (code != null) {
            return new Resolution(code, tokens.length > 1 ? tokens[1] : "");
        }

        // 2. Any whole token
        for (int i = 1; i < tokens.length; i++) {
            code = aliasToCode.get(NormalizationUtils.normalizeToken(tokens[i]));
            if (code != null) {
                return new Resolution(code, i + 1 < tokens.length ? tokens[i + 1] : "");
            }
        }

        // 3. Long-form name anywhere in the text
        String whole = NormalizationUtils.normalizeToken(cleaned);
        for (String alias : aliasesLongestFirst) {
            if (alias.length() >= MIN_SUBSTRING_ALIAS && whole.contains(alias)) {
                return new Resolution(aliasToCode.get(alias), "");
            }
        }
        return Resolution.UNCLASSIFIED;
    }

    private String lookup(String token, boolean allowPrefix) {
        if (token.isEmpty()) {
            return null;
        }
        String exact = aliasToCode.get(token);
        if (exact != null || !allowPrefix) {
            return exact;
        }
        for (String alias : aliasesLongestFirst) {
            if (token.startsWith(alias)) {
                return aliasToCode.get(alias);
            }
        }
        return null;
    }

    public record Resolution(String regionCode, String subRegionCode) {

        public static final Resolution UNCLASSIFIED = new Resolution(StructuredRecord.UNCLASSIFIED, "");
    }
}
