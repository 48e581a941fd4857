package com.lottoharvest.domain.model;

import java.util.List;

/**
 * Winning numbers of one round.
 */
public record DrawResult(int round, List<Integer> numbers, Integer bonus) {

    public DrawResult {
        numbers = List.copyOf(numbers);
    }
}
