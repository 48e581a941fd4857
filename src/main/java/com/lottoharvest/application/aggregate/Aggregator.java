package com.lottoharvest.application.aggregate;

import com.lottoharvest.domain.model.DedupKey;
import com.lottoharvest.domain.model.RoundSummary;
import com.lottoharvest.domain.model.StructuredRecord;
import com.lottoharvest.domain.model.Tier;
import com.lottoharvest.domain.model.TierSummary;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Folds records into per-region and per-round counts, one record at a time.
 *
 * <p>A record whose dedup key was already folded is ignored, so per-tier totals always
 * equal the number of distinct records. Not thread-safe: a run merges worker results
 * into one aggregator from a single thread.
 */
public class Aggregator {

    private final int maxSamples;
    private final Set<DedupKey> seen = new HashSet<>();

    /** (region, tier) buckets; region is a region code, ONLINE or UNCLASSIFIED. */
    private final Map<String, Map<Tier, AggregationBucket>> byRegion = new TreeMap<>();

    /** (round, tier) buckets. */
    private final Map<Integer, Map<Tier, AggregationBucket>> byRound = new TreeMap<>();

    /** round → tier → region → count. */
    private final Map<Integer, Map<Tier, Map<String, Integer>>> regionCountsByRound = new TreeMap<>();

    public Aggregator(int maxSamples) {
        this.maxSamples = maxSamples;
    }

    /**
     * @return true if the record was counted, false if its key had already been folded
     */
    public boolean fold(StructuredRecord record) {
        if (!seen.add(record.getDedupKey())) {
            return false;
        }
        Tier tier = record.getTier();
        String region = record.getRegionCode();

        byRegion.computeIfAbsent(region, r -> new EnumMap<>(Tier.class))
            .computeIfAbsent(tier, t -> new AggregationBucket(region, t, maxSamples))
            .add(record.getLabel());

        byRound.computeIfAbsent(record.getRound(), r -> new EnumMap<>(Tier.class))
            .computeIfAbsent(tier, t -> new AggregationBucket(String.valueOf(record.getRound()), t, maxSamples))
            .add(record.getLabel());

        regionCountsByRound.computeIfAbsent(record.getRound(), r -> new EnumMap<>(Tier.class))
            .computeIfAbsent(tier, t -> new TreeMap<>())
            .merge(region, 1, Integer::sum);
        return true;
    }

    /**
     * @return number of records counted
     */
    public int foldAll(Collection<StructuredRecord> records) {
        int counted = 0;
        for (StructuredRecord record : records) {
            if (fold(record)) {
                counted++;
            }
        }
        return counted;
    }

    public AggregationBucket regionBucket(String regionCode, Tier tier) {
        Map<Tier, AggregationBucket> tiers = byRegion.get(regionCode);
        return tiers == null ? null : tiers.get(tier);
    }

    public AggregationBucket roundBucket(int round, Tier tier) {
        Map<Tier, AggregationBucket> tiers = byRound.get(round);
        return tiers == null ? null : tiers.get(tier);
    }

    /** Distinct records folded for a tier across all rounds. */
    public int total(Tier tier) {
        int total = 0;
        for (Map<Tier, AggregationBucket> tiers : byRound.values()) {
            AggregationBucket bucket = tiers.get(tier);
            if (bucket != null) {
                total += bucket.getCount();
            }
        }
        return total;
    }

    /**
     * Per-round summaries, ascending by round.
     */
    public Map<Integer, RoundSummary> summaries() {
        Map<Integer, RoundSummary> out = new TreeMap<>();
        for (Map.Entry<Integer, Map<Tier, Map<String, Integer>>> roundEntry : regionCountsByRound.entrySet()) {
            Map<String, TierSummary> tiers = new LinkedHashMap<>();
            for (Map.Entry<Tier, Map<String, Integer>> tierEntry : roundEntry.getValue().entrySet()) {
                tiers.put(tierEntry.getKey().getCanonicalKey(), summarize(tierEntry.getValue()));
            }
            out.put(roundEntry.getKey(), new RoundSummary(roundEntry.getKey(), tiers));
        }
        return out;
    }

    private static TierSummary summarize(Map<String, Integer> regionCounts) {
        Map<String, Integer> regions = new TreeMap<>();
        int online = 0;
        int unclassified = 0;
        int total = 0;
        for (Map.Entry<String, Integer> e : regionCounts.entrySet()) {
            int count = e.getValue();
            total += count;
            if (StructuredRecord.ONLINE.equals(e.getKey())) {
                online += count;
            } else if (StructuredRecord.UNCLASSIFIED.equals(e.getKey())) {
                unclassified += count;
            } else {
                regions.put(e.getKey(), count);
            }
        }
        return new TierSummary(regions, online, unclassified, total - online, total);
    }
}
