package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.model.PrizeTierStat;

import java.util.List;

/**
 * Port for the lower-rank prize figures of a round.
 */
public interface PrizeBreakdownSource {

    /**
     * @throws com.lottoharvest.domain.exception.StructureNotFoundException if the prize table is not on the page
     */
    List<PrizeTierStat> fetchPrizeBreakdown(int round) throws FetchException;
}
