package com.lottoharvest.domain.model;

import java.util.regex.Pattern;

/**
 * Ranked listing categories published on the winning-store page.
 * Each tier has its own table shape and its own section label.
 */
public enum Tier {
    FIRST("rank1", 1, "1\\s*등\\s*배출점", true, 4, false),
    SECOND("rank2", 2, "2\\s*등\\s*배출점", false, 3, true);

    private final String canonicalKey;
    private final int rank;
    private final Pattern labelPattern;
    private final boolean classificationColumn;
    private final int minColumns;
    private final boolean paginated;

    Tier(String canonicalKey, int rank, String labelRegex, boolean classificationColumn,
         int minColumns, boolean paginated) {
        this.canonicalKey = canonicalKey;
        this.rank = rank;
        this.labelPattern = Pattern.compile(labelRegex);
        this.classificationColumn = classificationColumn;
        this.minColumns = minColumns;
        this.paginated = paginated;
    }

    public String getCanonicalKey() {
        return canonicalKey;
    }

    public int getRank() {
        return rank;
    }

    public Pattern getLabelPattern() {
        return labelPattern;
    }

    /** True when the tier's table carries a purchase-method column ("구분"). */
    public boolean hasClassificationColumn() {
        return classificationColumn;
    }

    public int getMinColumns() {
        return minColumns;
    }

    /** Single-page tiers are harvested with a page ceiling of one. */
    public boolean isPaginated() {
        return paginated;
    }

    public boolean isLabeledBy(String text) {
        return text != null && labelPattern.matcher(text).find();
    }

    @Override
    public String toString() {
        return canonicalKey;
    }
}
