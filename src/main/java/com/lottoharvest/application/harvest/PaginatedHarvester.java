package com.lottoharvest.application.harvest;

import com.lottoharvest.domain.exception.DecodeException;
import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.model.DedupKey;
import com.lottoharvest.domain.model.ExtractedTable;
import com.lottoharvest.domain.model.FailureKind;
import com.lottoharvest.domain.model.FailureRecord;
import com.lottoharvest.domain.model.FetchedDocument;
import com.lottoharvest.domain.model.RawRow;
import com.lottoharvest.domain.model.Section;
import com.lottoharvest.domain.model.SectionHarvest;
import com.lottoharvest.domain.model.StopReason;
import com.lottoharvest.domain.model.StructuredRecord;
import com.lottoharvest.domain.ports.RecordNormalizer;
import com.lottoharvest.domain.ports.SectionPageSource;
import com.lottoharvest.domain.ports.SectionRowExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the pages of one section until the data runs out or a ceiling is hit.
 *
 * <p>Pages are fetched strictly one after another: whether page n+1 is fetched depends
 * on what page n contained. Stop conditions, in the order they are checked:
 * <ol>
 *   <li>no table for the tier on the page</li>
 *   <li>the page yields no data rows</li>
 *   <li>every row was already seen on an earlier page (source ignoring the page parameter)</li>
 *   <li>record ceiling reached</li>
 *   <li>page ceiling reached</li>
 * </ol>
 * The run budget is checked before every fetch; when it runs out the records collected
 * so far are returned.
 */
public class PaginatedHarvester {

    private static final Logger logger = LoggerFactory.getLogger(PaginatedHarvester.class);

    private final SectionRowExtractor extractor;
    private final RecordNormalizer normalizer;
    private final HarvestLimits limits;
    private final Clock clock;

    public PaginatedHarvester(SectionRowExtractor extractor, RecordNormalizer normalizer,
                              HarvestLimits limits, Clock clock) {
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.limits = limits;
        this.clock = clock;
    }

    /**
     * Harvests one section.
     *
     * @param section  round and tier to harvest
     * @param source   page source owned by the calling worker
     * @param deadline run budget end; null for none
     * @return deduplicated records, the stop reason and any failures
     */
    public SectionHarvest harvest(Section section, SectionPageSource source, Instant deadline) {
        Set<DedupKey> seen = new HashSet<>();
        List<StructuredRecord> records = new ArrayList<>();
        List<FailureRecord> failures = new ArrayList<>();
        int pageCeiling = limits.pageCeilingFor(section.tier());

        int page = 0;
        StopReason stopReason;

        while (true) {
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                logger.warn("Run budget exhausted before page {} of {}, keeping {} records",
                    page + 1, section, records.size());
                failures.add(new FailureRecord(section.unitId(), FailureKind.GUARD_TRIPPED, "run budget exhausted"));
                stopReason = StopReason.BUDGET_EXHAUSTED;
                break;
            }
            if (page > 0 && !pause()) {
                logger.warn("Interrupted while pacing before page {} of {}, keeping {} records",
                    page + 1, section, records.size());
                failures.add(new FailureRecord(section.unitId(), FailureKind.INTERRUPTED,
                    "interrupted while pacing"));
                stopReason = StopReason.INTERRUPTED;
                break;
            }
            page++;

            FetchedDocument document;
            try {
                document = source.fetchPage(section, page);
            } catch (DecodeException e) {
                logger.warn("Page {} of {} could not be decoded: {}", page, section, e.getMessage());
                failures.add(new FailureRecord(pageUnit(section, page), FailureKind.DECODE, e.getMessage()));
                stopReason = StopReason.FETCH_FAILED;
                break;
            } catch (FetchException e) {
                logger.warn("Page {} of {} could not be fetched: {}", page, section, e.getMessage());
                failures.add(new FailureRecord(pageUnit(section, page), FailureKind.TRANSPORT, e.getMessage()));
                stopReason = StopReason.FETCH_FAILED;
                break;
            }

            // 1. Locate
            Optional<ExtractedTable> table = extractor.extract(document, section.tier());
            if (table.isEmpty()) {
                if (page == 1) {
                    failures.add(new FailureRecord(section.unitId(), FailureKind.STRUCTURE_NOT_FOUND,
                        "no " + section.tier() + " table on page"));
                }
                logger.debug("No {} table on page {} of round {}", section.tier(), page, section.round());
                stopReason = StopReason.NOT_FOUND;
                break;
            }

            // 2. Parse
            List<StructuredRecord> pageRecords = normalize(table.get(), section);
            if (pageRecords.isEmpty()) {
                stopReason = StopReason.EMPTY_PAGE;
                break;
            }

            // 3. Deduplicate, honouring the record ceiling
            int fresh = 0;
            boolean ceilingReached = false;
            for (StructuredRecord record : pageRecords) {
                if (!seen.add(record.getDedupKey())) {
                    continue;
                }
                fresh++;
                records.add(record);
                if (records.size() >= limits.recordCeiling()) {
                    ceilingReached = true;
                    break;
                }
            }
            logger.debug("Page {} of {}: {} rows, {} new", page, section, pageRecords.size(), fresh);

            if (fresh == 0) {
                stopReason = StopReason.REPEATED_PAGE;
                break;
            }
            if (ceilingReached) {
                logger.warn("Record ceiling {} reached for {}", limits.recordCeiling(), section);
                failures.add(new FailureRecord(section.unitId(), FailureKind.GUARD_TRIPPED,
                    "record ceiling " + limits.recordCeiling() + " reached"));
                stopReason = StopReason.RECORD_CEILING;
                break;
            }
            if (page >= pageCeiling) {
                if (section.tier().isPaginated()) {
                    logger.warn("Max pages reached ({}) for {}", pageCeiling, section);
                    failures.add(new FailureRecord(section.unitId(), FailureKind.GUARD_TRIPPED,
                        "max pages reached (" + pageCeiling + ")"));
                    stopReason = StopReason.MAX_PAGES;
                } else {
                    stopReason = StopReason.SINGLE_PAGE;
                }
                break;
            }
        }

        logger.info("Harvested {}: {} records over {} page(s), stopped on {}",
            section, records.size(), page, stopReason);
        return new SectionHarvest(section, records, stopReason, page, failures);
    }

    private List<StructuredRecord> normalize(ExtractedTable table, Section section) {
        List<StructuredRecord> out = new ArrayList<>();
        for (RawRow row : table.rows()) {
            normalizer.normalize(row, section, table.layout()).ifPresent(out::add);
        }
        return out;
    }

    private boolean pause() {
        long millis = limits.pacingDelay().toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String pageUnit(Section section, int page) {
        return section.unitId() + "/page-" + page;
    }
}
