package com.lottoharvest.domain.model;

/**
 * Logical identity of one harvest unit: a tier listing of one round.
 */
public record Section(int round, Tier tier) {

    public String unitId() {
        return "round-" + round + "/" + tier.getCanonicalKey();
    }

    @Override
    public String toString() {
        return unitId();
    }
}
