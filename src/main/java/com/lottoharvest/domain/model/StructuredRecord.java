package com.lottoharvest.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * One winning-store row of a round and tier, normalized.
 */
public final class StructuredRecord {

    /** Region code for stores selling through the online channel. */
    public static final String ONLINE = "ONLINE";

    /** Region code for locations no administrative area could be read from. */
    public static final String UNCLASSIFIED = "UNCLASSIFIED";

    private final int round;
    private final Tier tier;

    /** Store name as printed. */
    private final String label;

    /** Purchase method (자동, 수동, 반자동); null for tiers without that column. */
    private final String classification;

    private final String locationText;
    private final String regionCode;
    private final String subRegionCode;

    public StructuredRecord(int round, Tier tier, String label, String classification,
                            String locationText, String regionCode, String subRegionCode) {
        this.round = round;
        this.tier = Objects.requireNonNull(tier, "tier");
        this.label = label == null ? "" : label;
        this.classification = classification;
        this.locationText = locationText == null ? "" : locationText;
        this.regionCode = regionCode == null ? UNCLASSIFIED : regionCode;
        this.subRegionCode = subRegionCode == null ? "" : subRegionCode;
    }

    public int getRound() {
        return round;
    }

    public Tier getTier() {
        return tier;
    }

    public String getLabel() {
        return label;
    }

    public String getClassification() {
        return classification;
    }

    public String getLocationText() {
        return locationText;
    }

    public String getRegionCode() {
        return regionCode;
    }

    public String getSubRegionCode() {
        return subRegionCode;
    }

    @JsonIgnore
    public boolean isOnline() {
        return ONLINE.equals(regionCode);
    }

    @JsonIgnore
    public boolean isUnclassified() {
        return UNCLASSIFIED.equals(regionCode);
    }

    @JsonIgnore
    public DedupKey getDedupKey() {
        return DedupKey.of(round, tier, label, locationText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuredRecord)) return false;
        StructuredRecord that = (StructuredRecord) o;
        return round == that.round
            && tier == that.tier
            && label.equals(that.label)
            && Objects.equals(classification, that.classification)
            && locationText.equals(that.locationText)
            && regionCode.equals(that.regionCode)
            && subRegionCode.equals(that.subRegionCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(round, tier, label, classification, locationText, regionCode, subRegionCode);
    }

    @Override
    public String toString() {
        return "StructuredRecord{" + round + "/" + tier + " " + label + " @ " + regionCode
            + (subRegionCode.isEmpty() ? "" : " " + subRegionCode) + "}";
    }
}
