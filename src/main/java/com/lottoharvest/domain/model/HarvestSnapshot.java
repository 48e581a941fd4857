package com.lottoharvest.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory output of one harvest run. Writing it anywhere is up to the caller.
 */
public class HarvestSnapshot {

    private SnapshotMeta meta = new SnapshotMeta();

    /** Accepted records per round, ascending. */
    private Map<Integer, List<StructuredRecord>> byRound = new TreeMap<>();

    /** Accepted records per region code, newest round first within each region. */
    private Map<String, List<StructuredRecord>> byRegion = new LinkedHashMap<>();

    /** Per-round, per-tier counts. */
    private Map<Integer, RoundSummary> summaries = new TreeMap<>();

    /** Lower-rank prize figures, keyed by round. */
    private Map<Integer, List<PrizeTierStat>> prizes = new TreeMap<>();

    /** Occurrences of each main number across the window. Empty when disabled. */
    private Map<Integer, Integer> numberFrequency = new TreeMap<>();

    public SnapshotMeta getMeta() {
        return meta;
    }

    public void setMeta(SnapshotMeta meta) {
        this.meta = meta;
    }

    public Map<Integer, List<StructuredRecord>> getByRound() {
        return byRound;
    }

    public void setByRound(Map<Integer, List<StructuredRecord>> byRound) {
        this.byRound = byRound;
    }

    public Map<String, List<StructuredRecord>> getByRegion() {
        return byRegion;
    }

    public void setByRegion(Map<String, List<StructuredRecord>> byRegion) {
        this.byRegion = byRegion;
    }

    public Map<Integer, RoundSummary> getSummaries() {
        return summaries;
    }

    public void setSummaries(Map<Integer, RoundSummary> summaries) {
        this.summaries = summaries;
    }

    public Map<Integer, List<PrizeTierStat>> getPrizes() {
        return prizes;
    }

    public void setPrizes(Map<Integer, List<PrizeTierStat>> prizes) {
        this.prizes = prizes;
    }

    public Map<Integer, Integer> getNumberFrequency() {
        return numberFrequency;
    }

    public void setNumberFrequency(Map<Integer, Integer> numberFrequency) {
        this.numberFrequency = numberFrequency;
    }
}
