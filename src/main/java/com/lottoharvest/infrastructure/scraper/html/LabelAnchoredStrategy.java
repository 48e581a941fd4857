package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.Tier;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the text naming the tier ("1등 배출점") and takes the table it sits in or the
 * first table after it.
 *
 * <p>A following table only counts if it starts before the next label of another tier,
 * so an empty section never borrows its neighbour's table. When the label occurs more
 * than once the match with the most data rows wins. Tables already assigned to another
 * tier are not excluded: one physical table may stack several tiers. Text inside a data
 * cell is never a label, since stores are often named after the tier they won.
 */
public class LabelAnchoredStrategy implements LocatorStrategy {

    @Override
    public Optional<CandidateTable> locate(Document document, List<CandidateTable> candidates,
                                           Tier tier, Set<Integer> assigned) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Map<Element, Integer> positions = TableScanner.positions(document);
        List<Integer> otherLabels = new ArrayList<>();
        List<Element> ownLabels = new ArrayList<>();
        for (Element element : document.getAllElements()) {
            String own = element.ownText();
            if (own.isEmpty() || TableRowExtractor.isInDataCell(element)) {
                continue;
            }
            for (Tier t : Tier.values()) {
                if (t.isLabeledBy(own)) {
                    if (t == tier) {
                        ownLabels.add(element);
                    } else {
                        otherLabels.add(positions.get(element));
                    }
                }
            }
        }

        List<CandidateTable> matches = new ArrayList<>();
        for (Element label : ownLabels) {
            enclosing(label, candidates).or(() -> following(positions.get(label), candidates, otherLabels, tier))
                .ifPresent(matches::add);
        }
        return matches.stream()
            .max(Comparator.comparingInt(CandidateTable::getDataRowCount)
                .thenComparing(Comparator.comparingInt(CandidateTable::getIndex).reversed()));
    }

    private static Optional<CandidateTable> enclosing(Element label, List<CandidateTable> candidates) {
        for (Element parent : label.parents()) {
            if (parent.tagName().equals("table")) {
                for (CandidateTable candidate : candidates) {
                    if (candidate.getElement() == parent && candidate.getDataRowCount() > 0) {
                        return Optional.of(candidate);
                    }
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<CandidateTable> following(int labelPosition, List<CandidateTable> candidates,
                                                      List<Integer> otherLabels, Tier tier) {
        int boundary = Integer.MAX_VALUE;
        for (int other : otherLabels) {
            if (other > labelPosition && other < boundary) {
                boundary = other;
            }
        }
        for (CandidateTable candidate : candidates) {
            int position = candidate.getPosition();
            if (position <= labelPosition) {
                continue;
            }
            if (position > boundary) {
                return Optional.empty();
            }
            if (candidate.hasAddressHeader() || candidate.getColumnCount() >= tier.getMinColumns()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return "label";
    }
}
