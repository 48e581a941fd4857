package com.lottoharvest.infrastructure.normalize;

import com.lottoharvest.domain.model.ColumnLayout;
import com.lottoharvest.domain.model.HeaderKeywords;
import com.lottoharvest.domain.model.RawRow;
import com.lottoharvest.domain.model.Section;
import com.lottoharvest.domain.model.StructuredRecord;
import com.lottoharvest.domain.model.Tier;
import com.lottoharvest.domain.ports.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns a raw store row into a {@link StructuredRecord}.
 *
 * <p>Rejected as non-data: header-shaped rows, "no results" rows and rows shorter than
 * the tier's column count. Extra trailing cells (map links and the like) are ignored.
 * Online-channel rows resolve to {@link StructuredRecord#ONLINE} before any address
 * parsing.
 */
public class RowNormalizer implements RecordNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RowNormalizer.class);

    private final RegionResolver regionResolver;
    private final OnlineChannelPredicate onlineChannel;
    private final List<String> noResultPhrases;

    public RowNormalizer(RegionResolver regionResolver, OnlineChannelPredicate onlineChannel,
                         List<String> noResultPhrases) {
        this.regionResolver = regionResolver;
        this.onlineChannel = onlineChannel;
        this.noResultPhrases = noResultPhrases.stream()
            .map(NormalizationUtils::cleanText)
            .filter(p -> !p.isEmpty())
            .toList();
    }

    @Override
    public Optional<StructuredRecord> normalize(RawRow row, Section section, ColumnLayout layout) {
        Tier tier = section.tier();
        String joined = NormalizationUtils.cleanText(row.joined());

        if (joined.isEmpty()) {
            return Optional.empty();
        }
        if (HeaderKeywords.isHeaderSignature(joined)) {
            logger.debug("Rejected header row in {}: {}", section, joined);
            return Optional.empty();
        }
        for (String phrase : noResultPhrases) {
            if (joined.contains(phrase)) {
                logger.debug("Rejected no-result row in {}: {}", section, joined);
                return Optional.empty();
            }
        }
        if (row.size() < tier.getMinColumns()) {
            logger.debug("Rejected short row ({} cells) in {}: {}", row.size(), section, joined);
            return Optional.empty();
        }

        String label = NormalizationUtils.cleanText(row.cell(layout.labelIndex()));
        if (label.isEmpty()) {
            logger.debug("Rejected row without store name in {}: {}", section, joined);
            return Optional.empty();
        }

        String location = layout.hasLocation() ? NormalizationUtils.cleanText(row.cell(layout.locationIndex())) : "";
        if (location.isEmpty()) {
            location = longestCell(row);
        }

        String classification = null;
        if (tier.hasClassificationColumn() && layout.classificationIndex() >= 0) {
            String value = NormalizationUtils.cleanText(row.cell(layout.classificationIndex()));
            classification = value.isEmpty() ? null : value;
        }

        if (onlineChannel.test(label, location)) {
            return Optional.of(new StructuredRecord(section.round(), tier, label, classification,
                location, StructuredRecord.ONLINE, ""));
        }

        RegionResolver.Resolution region = regionResolver.resolve(location);
        return Optional.of(new StructuredRecord(section.round(), tier, label, classification,
            location, region.regionCode(), region.subRegionCode()));
    }

    private static String longestCell(RawRow row) {
        String longest = "";
        for (String cell : row.cells()) {
            String cleaned = NormalizationUtils.cleanText(cell);
            if (cleaned.length() > longest.length()) {
                longest = cleaned;
            }
        }
        return longest;
    }
}
