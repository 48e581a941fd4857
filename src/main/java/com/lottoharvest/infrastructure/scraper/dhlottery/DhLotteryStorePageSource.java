package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.model.FetchedDocument;
import com.lottoharvest.domain.model.Section;
import com.lottoharvest.domain.ports.FetchClient;
import com.lottoharvest.domain.ports.SectionPageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches pages of the winning-store listing. Closing it closes its client.
 */
public class DhLotteryStorePageSource implements SectionPageSource {

    private static final Logger logger = LoggerFactory.getLogger(DhLotteryStorePageSource.class);

    private final FetchClient client;
    private final DhLotteryEndpoints endpoints;

    public DhLotteryStorePageSource(FetchClient client, DhLotteryEndpoints endpoints) {
        this.client = client;
        this.endpoints = endpoints;
    }

    @Override
    public FetchedDocument fetchPage(Section section, int page) throws FetchException {
        logger.debug("Fetching store page {} of {}", page, section);
        FetchClient.FetchResponse response = client.fetchDocument(
            endpoints.storeUrl(), FetchClient.Method.POST, endpoints.storeForm(section, page));
        return new FetchedDocument(section, page, response.statusCode(), response.text(), response.finalUrl());
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (Exception e) {
            logger.warn("Error closing fetch client", e);
        }
    }
}
