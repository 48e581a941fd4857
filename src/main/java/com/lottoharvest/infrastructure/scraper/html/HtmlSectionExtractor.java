package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.ExtractedTable;
import com.lottoharvest.domain.model.FetchedDocument;
import com.lottoharvest.domain.model.RawRow;
import com.lottoharvest.domain.model.Tier;
import com.lottoharvest.domain.ports.SectionRowExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.List;
import java.util.Optional;

/**
 * {@link SectionRowExtractor} on jsoup: parse, locate, read rows.
 */
public class HtmlSectionExtractor implements SectionRowExtractor {

    private final SectionLocator locator;
    private final TableRowExtractor rowExtractor;

    public HtmlSectionExtractor(SectionLocator locator, TableRowExtractor rowExtractor) {
        this.locator = locator;
        this.rowExtractor = rowExtractor;
    }

    @Override
    public Optional<ExtractedTable> extract(FetchedDocument document, Tier tier) {
        Document parsed = Jsoup.parse(document.text(), document.url() == null ? "" : document.url());
        List<CandidateTable> candidates = TableScanner.scan(parsed);
        return locator.locate(parsed, candidates, tier).map(table -> {
            List<RawRow> rows = rowExtractor.extract(table, tier);
            return new ExtractedTable(table.layout(tier), rows);
        });
    }
}
