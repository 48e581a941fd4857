package com.lottoharvest.application.harvest;

import com.lottoharvest.domain.model.Tier;

import java.time.Duration;

/**
 * Safety ceilings and pacing for walking a section's pages.
 *
 * @param maxPages      page ceiling for paginated tiers
 * @param recordCeiling maximum records kept for one section
 * @param pacingDelay   pause between two page fetches of the same section
 */
public record HarvestLimits(int maxPages, int recordCeiling, Duration pacingDelay) {

    public HarvestLimits {
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be at least 1");
        }
        if (recordCeiling < 1) {
            throw new IllegalArgumentException("recordCeiling must be at least 1");
        }
        if (pacingDelay == null || pacingDelay.isNegative()) {
            throw new IllegalArgumentException("pacingDelay must be zero or positive");
        }
    }

    public int pageCeilingFor(Tier tier) {
        return tier.isPaginated() ? maxPages : 1;
    }
}
