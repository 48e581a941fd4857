package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.model.DrawResult;

import java.util.Optional;

/**
 * Port for the winning numbers of a round.
 */
public interface DrawResultSource {

    /**
     * @return the draw, or empty when the round is not published
     */
    Optional<DrawResult> fetchDraw(int round) throws FetchException;
}
