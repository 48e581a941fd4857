package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.ports.FetchClient;
import com.lottoharvest.domain.ports.SectionPageSource;
import com.lottoharvest.domain.ports.SectionPageSourceFactory;

import java.util.function.Supplier;

/**
 * Gives every worker a store page source with a client of its own.
 */
public class DhLotteryStorePageSourceFactory implements SectionPageSourceFactory {

    private final Supplier<FetchClient> clients;
    private final DhLotteryEndpoints endpoints;

    public DhLotteryStorePageSourceFactory(Supplier<FetchClient> clients, DhLotteryEndpoints endpoints) {
        this.clients = clients;
        this.endpoints = endpoints;
    }

    @Override
    public SectionPageSource open() {
        return new DhLotteryStorePageSource(clients.get(), endpoints);
    }
}
