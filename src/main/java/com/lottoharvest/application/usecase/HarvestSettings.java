package com.lottoharvest.application.usecase;

import java.time.Duration;

/**
 * Run-level knobs of {@link HarvestRoundsUseCase}.
 *
 * @param window          rounds to harvest, ending at the latest round
 * @param workers         size of the worker pool
 * @param runBudget       wall-clock budget of one run; null or zero for none
 * @param maxSamples      sample labels kept per aggregation bucket
 * @param roundHint       previous run's latest round; may be null
 * @param prizeBreakdown  fetch the prize table of the latest round
 * @param numberFrequency fetch draw numbers for every round in the window
 */
public record HarvestSettings(
    int window,
    int workers,
    Duration runBudget,
    int maxSamples,
    Integer roundHint,
    boolean prizeBreakdown,
    boolean numberFrequency
) {

    public HarvestSettings {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
    }
}
