package com.lottoharvest.domain.model;

/**
 * Column positions of the fields a record is built from. A negative index means
 * the column was not identified.
 */
public record ColumnLayout(int labelIndex, int classificationIndex, int locationIndex) {

    public static final int UNKNOWN = -1;

    /**
     * Positional layout used when a table has no usable header.
     * First-tier tables read 번호 | 상호명 | 구분 | 소재지, second-tier tables 번호 | 상호명 | 소재지.
     */
    public static ColumnLayout positional(Tier tier) {
        return tier.hasClassificationColumn()
            ? new ColumnLayout(1, 2, 3)
            : new ColumnLayout(1, UNKNOWN, 2);
    }

    public boolean hasLocation() {
        return locationIndex >= 0;
    }
}
