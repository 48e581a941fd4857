package com.lottoharvest.application.usecase;

import com.lottoharvest.application.aggregate.Aggregator;
import com.lottoharvest.application.aggregate.NumberFrequency;
import com.lottoharvest.application.harvest.PaginatedHarvester;
import com.lottoharvest.domain.exception.DecodeException;
import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.exception.StructureNotFoundException;
import com.lottoharvest.domain.model.DrawResult;
import com.lottoharvest.domain.model.FailureKind;
import com.lottoharvest.domain.model.FailureRecord;
import com.lottoharvest.domain.model.HarvestSnapshot;
import com.lottoharvest.domain.model.PrizeTierStat;
import com.lottoharvest.domain.model.RoundResolution;
import com.lottoharvest.domain.model.Section;
import com.lottoharvest.domain.model.SectionHarvest;
import com.lottoharvest.domain.model.SnapshotMeta;
import com.lottoharvest.domain.model.StopReason;
import com.lottoharvest.domain.model.StructuredRecord;
import com.lottoharvest.domain.model.Tier;
import com.lottoharvest.domain.ports.DrawResultSource;
import com.lottoharvest.domain.ports.PrizeBreakdownSource;
import com.lottoharvest.domain.ports.RoundResolver;
import com.lottoharvest.domain.ports.SectionPageSource;
import com.lottoharvest.domain.ports.SectionPageSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for harvesting the winning stores of the most recent rounds.
 *
 * <p>Only round resolution is fatal. Every (round, tier) section runs on the worker pool
 * with its own page source; a failing section becomes a failure record and the rest of
 * the run continues. Worker results are merged into the aggregator from the calling
 * thread only.
 */
public class HarvestRoundsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(HarvestRoundsUseCase.class);

    private final RoundResolver roundResolver;
    private final PaginatedHarvester harvester;
    private final SectionPageSourceFactory pageSources;
    private final PrizeBreakdownSource prizeSource;
    private final DrawResultSource drawSource;
    private final HarvestSettings settings;
    private final Clock clock;

    public HarvestRoundsUseCase(RoundResolver roundResolver,
                                PaginatedHarvester harvester,
                                SectionPageSourceFactory pageSources,
                                PrizeBreakdownSource prizeSource,
                                DrawResultSource drawSource,
                                HarvestSettings settings,
                                Clock clock) {
        this.roundResolver = roundResolver;
        this.harvester = harvester;
        this.pageSources = pageSources;
        this.prizeSource = prizeSource;
        this.drawSource = drawSource;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Resolves the latest round without harvesting anything.
     *
     * @throws com.lottoharvest.domain.exception.RoundResolutionException if it cannot be determined
     */
    public RoundResolution resolveLatestRound() {
        return roundResolver.resolve(settings.roundHint());
    }

    /**
     * Runs one harvest over the configured window.
     *
     * @return snapshot of everything collected, with per-unit failures in its meta
     * @throws com.lottoharvest.domain.exception.RoundResolutionException if the latest round cannot be determined
     */
    public HarvestSnapshot execute() {
        Instant startedAt = clock.instant();
        Instant deadline = settings.runBudget() == null || settings.runBudget().isZero()
            ? null
            : startedAt.plus(settings.runBudget());

        // 1. Resolve the latest round; nothing else can run without it
        RoundResolution resolution = roundResolver.resolve(settings.roundHint());
        int latest = resolution.latestRound();
        int oldest = Math.max(1, latest - settings.window() + 1);
        logger.info("Starting harvest of rounds {}..{} (resolved by {})", oldest, latest, resolution.strategy());

        // 2. Harvest every (round, tier) section on the pool
        List<Section> sections = new ArrayList<>();
        for (int round = latest; round >= oldest; round--) {
            for (Tier tier : Tier.values()) {
                sections.add(new Section(round, tier));
            }
        }
        List<SectionHarvest> harvests = harvestAll(sections, deadline);

        // 3. Merge on this thread only
        Aggregator aggregator = new Aggregator(settings.maxSamples());
        List<FailureRecord> failures = new ArrayList<>();
        Map<Integer, List<StructuredRecord>> byRound = new TreeMap<>();
        int processedUnits = 0;

        for (SectionHarvest harvest : harvests) {
            failures.addAll(harvest.failures());
            List<StructuredRecord> records = harvest.records();
            if (allUnclassified(records)) {
                logger.warn("No region resolved for any of the {} records of {}, check the alias table",
                    records.size(), harvest.section());
            }
            for (StructuredRecord record : records) {
                if (aggregator.fold(record)) {
                    byRound.computeIfAbsent(record.getRound(), r -> new ArrayList<>()).add(record);
                }
            }
            if (!harvest.isFailed()) {
                processedUnits++;
            }
        }

        HarvestSnapshot snapshot = new HarvestSnapshot();

        // 4. Auxiliary fetches
        if (settings.prizeBreakdown() && prizeSource != null) {
            if (fetchPrizes(latest, deadline, snapshot, failures)) {
                processedUnits++;
            }
        }
        if (settings.numberFrequency() && drawSource != null) {
            processedUnits += fetchDraws(oldest, latest, deadline, snapshot, failures);
        }

        // 5. Snapshot
        snapshot.setByRound(byRound);
        snapshot.setByRegion(groupByRegion(byRound));
        snapshot.setSummaries(aggregator.summaries());

        SnapshotMeta meta = snapshot.getMeta();
        meta.setLatestRound(latest);
        meta.setWindow(latest - oldest + 1);
        meta.setGeneratedAt(clock.instant());
        meta.setRoundStrategy(resolution.strategy());
        meta.setRoundDeviation(resolution.deviation());
        meta.setProcessedUnits(processedUnits);
        meta.setFailures(failures);

        logger.info("Harvest finished: {} units processed, {} failures, {} rank1 and {} rank2 records",
            processedUnits, failures.size(), aggregator.total(Tier.FIRST), aggregator.total(Tier.SECOND));
        return snapshot;
    }

    private List<SectionHarvest> harvestAll(List<Section> sections, Instant deadline) {
        ExecutorService executorService = Executors.newFixedThreadPool(Math.min(settings.workers(), sections.size()));
        try {
            List<CompletableFuture<SectionHarvest>> futures = sections.stream()
                .map(section -> CompletableFuture.supplyAsync(() -> harvestSection(section, deadline), executorService))
                .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<SectionHarvest> results = new ArrayList<>();
            for (CompletableFuture<SectionHarvest> future : futures) {
                results.add(future.join());
            }
            return results;
        } finally {
            executorService.shutdownNow();
        }
    }

    private SectionHarvest harvestSection(Section section, Instant deadline) {
        try (SectionPageSource source = pageSources.open()) {
            return harvester.harvest(section, source, deadline);
        } catch (Exception e) {
            logger.error("Section {} failed", section, e);
            FailureKind kind = e instanceof FetchException ? kindOf((FetchException) e) : FailureKind.UNEXPECTED;
            return new SectionHarvest(section, List.of(), StopReason.FETCH_FAILED, 0,
                List.of(new FailureRecord(section.unitId(), kind, String.valueOf(e.getMessage()))));
        }
    }

    private boolean fetchPrizes(int round, Instant deadline, HarvestSnapshot snapshot, List<FailureRecord> failures) {
        String unitId = "round-" + round + "/prizes";
        if (budgetExhausted(deadline)) {
            failures.add(new FailureRecord(unitId, FailureKind.GUARD_TRIPPED, "run budget exhausted"));
            return false;
        }
        try {
            List<PrizeTierStat> stats = prizeSource.fetchPrizeBreakdown(round);
            snapshot.getPrizes().put(round, stats);
            logger.info("Prize breakdown for round {}: {} ranks", round, stats.size());
            return true;
        } catch (StructureNotFoundException e) {
            logger.warn("No prize table for round {}: {}", round, e.getMessage());
            failures.add(new FailureRecord(unitId, FailureKind.STRUCTURE_NOT_FOUND, e.getMessage()));
        } catch (FetchException e) {
            logger.warn("Prize page for round {} could not be fetched: {}", round, e.getMessage());
            failures.add(new FailureRecord(unitId, kindOf(e), e.getMessage()));
        }
        return false;
    }

    private int fetchDraws(int oldest, int latest, Instant deadline, HarvestSnapshot snapshot,
                           List<FailureRecord> failures) {
        NumberFrequency frequency = new NumberFrequency();
        int fetched = 0;
        for (int round = latest; round >= oldest; round--) {
            String unitId = "round-" + round + "/draw";
            if (budgetExhausted(deadline)) {
                logger.warn("Run budget exhausted before draw of round {}", round);
                failures.add(new FailureRecord(unitId, FailureKind.GUARD_TRIPPED, "run budget exhausted"));
                break;
            }
            try {
                Optional<DrawResult> draw = drawSource.fetchDraw(round);
                if (draw.isPresent()) {
                    frequency.fold(draw.get());
                    fetched++;
                } else {
                    failures.add(new FailureRecord(unitId, FailureKind.STRUCTURE_NOT_FOUND, "draw not published"));
                }
            } catch (FetchException e) {
                logger.warn("Draw of round {} could not be fetched: {}", round, e.getMessage());
                failures.add(new FailureRecord(unitId, kindOf(e), e.getMessage()));
            }
        }
        if (frequency.roundsCounted() > 0) {
            snapshot.setNumberFrequency(frequency.asMap());
        }
        return fetched;
    }

    private boolean budgetExhausted(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private static boolean allUnclassified(List<StructuredRecord> records) {
        return !records.isEmpty() && records.stream().allMatch(StructuredRecord::isUnclassified);
    }

    private static FailureKind kindOf(FetchException e) {
        return e instanceof DecodeException ? FailureKind.DECODE : FailureKind.TRANSPORT;
    }

    /**
     * Groups records by region code, newest round first inside each region.
     */
    private static Map<String, List<StructuredRecord>> groupByRegion(Map<Integer, List<StructuredRecord>> byRound) {
        Map<String, List<StructuredRecord>> grouped = new TreeMap<>();
        for (List<StructuredRecord> records : byRound.values()) {
            for (StructuredRecord record : records) {
                grouped.computeIfAbsent(record.getRegionCode(), r -> new ArrayList<>()).add(record);
            }
        }
        Map<String, List<StructuredRecord>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<StructuredRecord>> e : grouped.entrySet()) {
            List<StructuredRecord> records = new ArrayList<>(e.getValue());
            records.sort(Comparator.comparingInt(StructuredRecord::getRound).reversed()
                .thenComparing(r -> r.getTier().getRank()));
            out.put(e.getKey(), records);
        }
        return out;
    }
}
