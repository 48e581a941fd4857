package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.Tier;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves each tier of a page to at most one table by running an ordered strategy chain.
 *
 * <p>Tiers are resolved in rank order over the whole page so that a table claimed by a
 * higher tier is known when a lower tier falls back to scoring. The same page always
 * yields the same assignment.
 */
public class SectionLocator {

    private static final Logger logger = LoggerFactory.getLogger(SectionLocator.class);

    private final List<LocatorStrategy> chain;

    public SectionLocator(List<LocatorStrategy> chain) {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("locator chain must not be empty");
        }
        this.chain = List.copyOf(chain);
    }

    public static SectionLocator defaultChain() {
        return new SectionLocator(List.of(new LabelAnchoredStrategy(), new ScoreAnchoredStrategy()));
    }

    public Map<Tier, CandidateTable> locateAll(Document document, List<CandidateTable> candidates) {
        Map<Tier, CandidateTable> resolved = new EnumMap<>(Tier.class);
        Set<Integer> assigned = new HashSet<>();
        for (Tier tier : Tier.values()) {
            for (LocatorStrategy strategy : chain) {
                Optional<CandidateTable> found = strategy.locate(document, candidates, tier, assigned);
                if (found.isPresent()) {
                    logger.debug("{} resolved to {} by {} strategy", tier, found.get(), strategy.getName());
                    resolved.put(tier, found.get());
                    assigned.add(found.get().getIndex());
                    break;
                }
            }
            if (!resolved.containsKey(tier)) {
                logger.debug("{} not found among {} tables", tier, candidates.size());
            }
        }
        return resolved;
    }

    public Optional<CandidateTable> locate(Document document, List<CandidateTable> candidates, Tier tier) {
        return Optional.ofNullable(locateAll(document, candidates).get(tier));
    }
}
