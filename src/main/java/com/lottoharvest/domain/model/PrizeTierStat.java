package com.lottoharvest.domain.model;

/**
 * Prize figures of one lower rank (2 to 5) for a round.
 */
public record PrizeTierStat(int rank, long totalPrize, long winners, long perGamePrize, String criteria) {
}
