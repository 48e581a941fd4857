package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.model.ProbeResult;

/**
 * Port answering whether the source has published a given round.
 */
public interface RoundProbe {

    /**
     * Checks one round index. Transport and decode problems are reported as
     * {@link ProbeResult#UNKNOWN}, never as {@link ProbeResult#ABSENT}.
     */
    ProbeResult probe(int round);
}
