package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.model.ExtractedTable;
import com.lottoharvest.domain.model.FetchedDocument;
import com.lottoharvest.domain.model.Tier;

import java.util.Optional;

/**
 * Port locating a tier's table in a fetched page and reading its rows.
 */
public interface SectionRowExtractor {

    /**
     * @return the tier's rows, or empty when no table for the tier is on the page
     */
    Optional<ExtractedTable> extract(FetchedDocument document, Tier tier);
}
