package com.lottoharvest.domain.model;

/**
 * The latest published round and how it was determined.
 *
 * @param latestRound  newest round the source publishes
 * @param strategy     name of the resolver that produced it
 * @param dateEstimate round computed from the calendar, when it was consulted
 * @param deviation    true when the calendar estimate disagreed beyond tolerance
 */
public record RoundResolution(int latestRound, String strategy, Integer dateEstimate, boolean deviation) {

    public static RoundResolution of(int latestRound, String strategy) {
        return new RoundResolution(latestRound, strategy, null, false);
    }
}
