package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.Tier;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the highest-scoring table whose shape fits the tier, skipping tables already
 * taken by another tier. Ties go to the earlier table.
 */
public class ScoreAnchoredStrategy implements LocatorStrategy {

    @Override
    public Optional<CandidateTable> locate(Document document, List<CandidateTable> candidates,
                                           Tier tier, Set<Integer> assigned) {
        CandidateTable best = null;
        int bestScore = Integer.MIN_VALUE;
        for (CandidateTable candidate : candidates) {
            if (assigned.contains(candidate.getIndex()) || !candidate.matchesShape(tier)) {
                continue;
            }
            int score = candidate.scoreFor(tier);
            if (score >= CandidateTable.MIN_SCORE && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public String getName() {
        return "score";
    }
}
