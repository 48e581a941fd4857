package com.lottoharvest.application.aggregate;

import com.lottoharvest.domain.model.Tier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running count for one (dimension, tier) pair, with a few sample labels.
 * The dimension is a region code or a round number.
 */
public class AggregationBucket {

    private final String dimension;
    private final Tier tier;
    private final int maxSamples;
    private final List<String> samples = new ArrayList<>();
    private int count;

    public AggregationBucket(String dimension, Tier tier, int maxSamples) {
        this.dimension = dimension;
        this.tier = tier;
        this.maxSamples = Math.max(0, maxSamples);
    }

    void add(String sample) {
        count++;
        if (samples.size() < maxSamples && sample != null && !sample.isBlank()) {
            samples.add(sample);
        }
    }

    public String getDimension() {
        return dimension;
    }

    public Tier getTier() {
        return tier;
    }

    public int getCount() {
        return count;
    }

    public List<String> getSamples() {
        return Collections.unmodifiableList(samples);
    }
}
