package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.model.PrizeTierStat;
import com.lottoharvest.domain.ports.FetchClient;
import com.lottoharvest.domain.ports.PrizeBreakdownSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scraper for the lower-rank prize figures of a round.
 */
public class DhLotteryPrizeScraper implements PrizeBreakdownSource {

    private static final Logger logger = LoggerFactory.getLogger(DhLotteryPrizeScraper.class);

    private final FetchClient client;
    private final DhLotteryEndpoints endpoints;
    private final PrizeTableParser parser;

    public DhLotteryPrizeScraper(FetchClient client, DhLotteryEndpoints endpoints, PrizeTableParser parser) {
        this.client = client;
        this.endpoints = endpoints;
        this.parser = parser;
    }

    @Override
    public List<PrizeTierStat> fetchPrizeBreakdown(int round) throws FetchException {
        String url = endpoints.byWinUrl(round);
        logger.debug("Fetching prize table of round {}", round);
        return parser.parse(client.get(url).text());
    }
}
