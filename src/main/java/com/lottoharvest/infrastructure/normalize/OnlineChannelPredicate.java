package com.lottoharvest.infrastructure.normalize;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a row is an online-channel sale. Which fields are checked is
 * configurable because the source has marked online sales in the store name, in the
 * address, or both.
 */
public class OnlineChannelPredicate {

    public enum Scope {
        LOCATION,
        LABEL,
        EITHER
    }

    private final List<String> markers;
    private final Scope scope;

    public OnlineChannelPredicate(List<String> markers, Scope scope) {
        this.markers = markers.stream()
            .map(NormalizationUtils::cleanText)
            .filter(m -> !m.isEmpty())
            .map(m -> m.toLowerCase(Locale.ROOT))
            .toList();
        this.scope = scope == null ? Scope.EITHER : scope;
    }

    public boolean test(String label, String locationText) {
        return switch (scope) {
            case LOCATION -> matches(locationText);
            case LABEL -> matches(label);
            case EITHER -> matches(locationText) || matches(label);
        };
    }

    public Scope getScope() {
        return scope;
    }

    private boolean matches(String text) {
        String lower = NormalizationUtils.cleanText(text).toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) {
            return false;
        }
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
