package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.Tier;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One way of finding a tier's table in a page. Strategies are tried in order by
 * {@link SectionLocator}; the first one that answers wins.
 */
public interface LocatorStrategy {

    /**
     * @param document   parsed page
     * @param candidates every table of the page, in document order
     * @param tier       tier to find
     * @param assigned   indexes of tables already chosen for another tier of this page
     */
    Optional<CandidateTable> locate(Document document, List<CandidateTable> candidates, Tier tier, Set<Integer> assigned);

    String getName();
}
