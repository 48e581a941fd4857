package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.model.RoundResolution;

/**
 * Port producing the newest round the source currently publishes.
 */
public interface RoundResolver {

    /**
     * @param hint round believed to be published, typically the previous run's latest; may be null
     * @return the resolved latest round
     * @throws com.lottoharvest.domain.exception.RoundResolutionException if no round could be determined
     */
    RoundResolution resolve(Integer hint);

    /** Short name reported in the snapshot meta. */
    String getStrategyName();
}
