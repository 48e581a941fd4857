package com.lottoharvest.domain.model;

import java.util.Map;

/**
 * Per-tier summaries of one round, keyed by tier canonical key.
 */
public record RoundSummary(int round, Map<String, TierSummary> tiers) {
}
