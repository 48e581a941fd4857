package com.lottoharvest.application.aggregate;

import com.lottoharvest.domain.model.DrawResult;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Counts how often each main number was drawn across a set of rounds.
 * Bonus numbers are not counted; a round folded twice counts once.
 */
public class NumberFrequency {

    public static final int MIN_NUMBER = 1;
    public static final int MAX_NUMBER = 45;

    private final int[] counts = new int[MAX_NUMBER + 1];
    private final Set<Integer> rounds = new HashSet<>();

    public boolean fold(DrawResult draw) {
        if (!rounds.add(draw.round())) {
            return false;
        }
        for (Integer n : draw.numbers()) {
            if (n != null && n >= MIN_NUMBER && n <= MAX_NUMBER) {
                counts[n]++;
            }
        }
        return true;
    }

    public int roundsCounted() {
        return rounds.size();
    }

    /** Every number from 1 to 45, including those never drawn. */
    public Map<Integer, Integer> asMap() {
        Map<Integer, Integer> out = new TreeMap<>();
        for (int n = MIN_NUMBER; n <= MAX_NUMBER; n++) {
            out.put(n, counts[n]);
        }
        return out;
    }
}
