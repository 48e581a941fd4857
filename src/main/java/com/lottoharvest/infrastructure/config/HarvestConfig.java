package com.lottoharvest.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lottoharvest.application.harvest.HarvestLimits;
import com.lottoharvest.application.harvest.PaginatedHarvester;
import com.lottoharvest.application.round.DateDerivedRoundResolver;
import com.lottoharvest.application.round.ProbeRoundResolver;
import com.lottoharvest.application.round.ReconcilingRoundResolver;
import com.lottoharvest.application.usecase.HarvestRoundsUseCase;
import com.lottoharvest.application.usecase.HarvestSettings;
import com.lottoharvest.domain.ports.FetchClient;
import com.lottoharvest.domain.ports.RoundResolver;
import com.lottoharvest.infrastructure.http.HttpFetchClient;
import com.lottoharvest.infrastructure.http.RetryPolicy;
import com.lottoharvest.infrastructure.normalize.OnlineChannelPredicate;
import com.lottoharvest.infrastructure.normalize.RegionDefinition;
import com.lottoharvest.infrastructure.normalize.RegionResolver;
import com.lottoharvest.infrastructure.normalize.RowNormalizer;
import com.lottoharvest.infrastructure.scraper.dhlottery.DhLotteryEndpoints;
import com.lottoharvest.infrastructure.scraper.dhlottery.DhLotteryPrizeScraper;
import com.lottoharvest.infrastructure.scraper.dhlottery.DhLotteryRoundProbe;
import com.lottoharvest.infrastructure.scraper.dhlottery.DhLotteryStorePageSourceFactory;
import com.lottoharvest.infrastructure.scraper.dhlottery.LatestRoundPageResolver;
import com.lottoharvest.infrastructure.scraper.dhlottery.PrizeTableParser;
import com.lottoharvest.infrastructure.scraper.html.HtmlSectionExtractor;
import com.lottoharvest.infrastructure.scraper.html.SectionLocator;
import com.lottoharvest.infrastructure.scraper.html.TableRowExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;

/**
 * Wires the harvester from {@link HarvestProperties}.
 */
@Configuration
public class HarvestConfig {

    private static final Logger logger = LoggerFactory.getLogger(HarvestConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(HarvestProperties properties) {
        HarvestProperties.Http http = properties.getHttp();
        return new RetryPolicy(http.getMaxAttempts(), http.getInitialBackoff(), http.getBackoffMultiplier(),
            http.getMaxBackoff(), new HashSet<>(http.getRetryableStatuses()));
    }

    @Bean
    public HttpFetchClient.Settings httpSettings(HarvestProperties properties) {
        HarvestProperties.Http http = properties.getHttp();
        return new HttpFetchClient.Settings(http.getConnectTimeout(), http.getResponseTimeout(),
            http.getUserAgent(), http.getAcceptLanguage(), http.getFallbackHost());
    }

    /**
     * Client for round discovery and the auxiliary pages. Store pages use their own
     * clients, one per worker.
     */
    @Bean
    public FetchClient fetchClient(HttpFetchClient.Settings settings, RetryPolicy retryPolicy) {
        return new HttpFetchClient(settings, retryPolicy);
    }

    @Bean
    public DhLotteryEndpoints dhLotteryEndpoints(HarvestProperties properties) {
        HarvestProperties.Source source = properties.getSource();
        return new DhLotteryEndpoints(source.getStoreUrl(), source.getByWinUrl(), source.getLatestUrl(),
            source.getApiUrl());
    }

    @Bean
    public DhLotteryRoundProbe dhLotteryRoundProbe(FetchClient fetchClient, DhLotteryEndpoints endpoints,
                                                   ObjectMapper objectMapper) {
        return new DhLotteryRoundProbe(fetchClient, endpoints, objectMapper);
    }

    @Bean
    public RoundResolver roundResolver(HarvestProperties properties, Clock clock, FetchClient fetchClient,
                                       DhLotteryEndpoints endpoints, DhLotteryRoundProbe probe) {
        HarvestProperties.Round round = properties.getRound();
        DateDerivedRoundResolver calendar = new DateDerivedRoundResolver(clock, round.getAnchorRound(),
            OffsetDateTime.parse(round.getAnchorDate()), round.getDrawDay(), round.getPublishHour(),
            ZoneId.of(round.getZone()));
        ProbeRoundResolver probing = new ProbeRoundResolver(probe, round.getProbeCeiling(), round.getAnchorRound());

        List<RoundResolver> authorities = switch (round.getStrategy()) {
            case PROBE -> List.of(probing);
            case PAGE -> List.of(new LatestRoundPageResolver(fetchClient, endpoints), probing);
            case DATE -> List.of();
        };
        boolean fallback = round.isFallbackToDate() || authorities.isEmpty();
        logger.info("Round strategy {} (max deviation {}, calendar fallback {})",
            round.getStrategy(), round.getMaxDeviation(), fallback);
        return new ReconcilingRoundResolver(authorities, calendar, round.getMaxDeviation(), fallback);
    }

    @Bean
    public RowNormalizer rowNormalizer(HarvestProperties properties) {
        HarvestProperties.Normalize normalize = properties.getNormalize();
        List<RegionDefinition> regions = normalize.getRegions().stream()
            .map(r -> new RegionDefinition(r.getCode(), r.getAliases()))
            .toList();
        if (regions.isEmpty()) {
            logger.warn("No region aliases configured; every offline store will be unclassified");
        }
        return new RowNormalizer(new RegionResolver(regions),
            new OnlineChannelPredicate(normalize.getOnlineMarkers(), normalize.getOnlineScope()),
            normalize.getNoResultPhrases());
    }

    @Bean
    public HtmlSectionExtractor htmlSectionExtractor() {
        return new HtmlSectionExtractor(SectionLocator.defaultChain(), new TableRowExtractor());
    }

    @Bean
    public PaginatedHarvester paginatedHarvester(HtmlSectionExtractor extractor, RowNormalizer normalizer,
                                                 HarvestProperties properties, Clock clock) {
        HarvestLimits limits = new HarvestLimits(properties.getMaxPages(), properties.getRecordCeiling(),
            properties.getPacingDelay());
        return new PaginatedHarvester(extractor, normalizer, limits, clock);
    }

    @Bean
    public DhLotteryPrizeScraper dhLotteryPrizeScraper(FetchClient fetchClient, DhLotteryEndpoints endpoints) {
        return new DhLotteryPrizeScraper(fetchClient, endpoints, new PrizeTableParser());
    }

    @Bean
    public HarvestRoundsUseCase harvestRoundsUseCase(HarvestProperties properties,
                                                     RoundResolver roundResolver,
                                                     PaginatedHarvester harvester,
                                                     HttpFetchClient.Settings httpSettings,
                                                     RetryPolicy retryPolicy,
                                                     DhLotteryEndpoints endpoints,
                                                     DhLotteryPrizeScraper prizeScraper,
                                                     DhLotteryRoundProbe drawSource,
                                                     Clock clock) {
        HarvestSettings settings = new HarvestSettings(
            properties.getWindow(),
            properties.getWorkers(),
            properties.getRunBudget(),
            properties.getAggregate().getMaxSamples(),
            properties.getRound().getHint(),
            properties.getFeatures().isPrizeBreakdown(),
            properties.getFeatures().isNumberFrequency());
        DhLotteryStorePageSourceFactory pageSources = new DhLotteryStorePageSourceFactory(
            () -> new HttpFetchClient(httpSettings, retryPolicy), endpoints);
        return new HarvestRoundsUseCase(roundResolver, harvester, pageSources, prizeScraper, drawSource,
            settings, clock);
    }
}
