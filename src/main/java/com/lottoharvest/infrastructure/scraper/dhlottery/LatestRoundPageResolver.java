package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.exception.RoundResolutionException;
import com.lottoharvest.domain.exception.StructureNotFoundException;
import com.lottoharvest.domain.model.RoundResolution;
import com.lottoharvest.domain.ports.FetchClient;
import com.lottoharvest.domain.ports.RoundResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Reads the newest round from the results page. One request; ignores the hint.
 */
public class LatestRoundPageResolver implements RoundResolver {

    private static final Logger logger = LoggerFactory.getLogger(LatestRoundPageResolver.class);

    public static final String STRATEGY = "page";

    private final FetchClient client;
    private final DhLotteryEndpoints endpoints;

    public LatestRoundPageResolver(FetchClient client, DhLotteryEndpoints endpoints) {
        this.client = client;
        this.endpoints = endpoints;
    }

    @Override
    public RoundResolution resolve(Integer hint) {
        String html;
        try {
            html = client.get(endpoints.latestUrl()).text();
        } catch (FetchException e) {
            throw new RoundResolutionException("Results page unavailable: " + e.getMessage(), e);
        }
        OptionalInt round = LatestRoundPageParser.parse(html);
        if (round.isEmpty()) {
            throw new StructureNotFoundException("No round marker on " + endpoints.latestUrl());
        }
        logger.info("Results page shows round {}", round.getAsInt());
        return RoundResolution.of(round.getAsInt(), STRATEGY);
    }

    @Override
    public String getStrategyName() {
        return STRATEGY;
    }
}
