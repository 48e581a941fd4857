package com.lottoharvest.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Run-level information attached to a harvest snapshot.
 */
public class SnapshotMeta {

    /** Newest round the source publishes at run time. */
    private int latestRound;

    /** Number of rounds (ending at latestRound) the run covered. */
    private int window;

    private Instant generatedAt;

    /** Resolver that produced latestRound (probe, page, date, ...). */
    private String roundStrategy;

    /** True when the calendar estimate disagreed with the resolved round. */
    private boolean roundDeviation;

    /** Units (round/tier sections and auxiliary fetches) that completed. */
    private int processedUnits;

    private List<FailureRecord> failures = new ArrayList<>();

    public int getLatestRound() {
        return latestRound;
    }

    public void setLatestRound(int latestRound) {
        this.latestRound = latestRound;
    }

    public int getWindow() {
        return window;
    }

    public void setWindow(int window) {
        this.window = window;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(Instant generatedAt) {
        this.generatedAt = generatedAt;
    }

    public String getRoundStrategy() {
        return roundStrategy;
    }

    public void setRoundStrategy(String roundStrategy) {
        this.roundStrategy = roundStrategy;
    }

    public boolean isRoundDeviation() {
        return roundDeviation;
    }

    public void setRoundDeviation(boolean roundDeviation) {
        this.roundDeviation = roundDeviation;
    }

    public int getProcessedUnits() {
        return processedUnits;
    }

    public void setProcessedUnits(int processedUnits) {
        this.processedUnits = processedUnits;
    }

    public List<FailureRecord> getFailures() {
        return failures;
    }

    public void setFailures(List<FailureRecord> failures) {
        this.failures = failures;
    }
}
