package com.lottoharvest.application.round;

import com.lottoharvest.domain.exception.RoundResolutionException;
import com.lottoharvest.domain.exception.StructureNotFoundException;
import com.lottoharvest.domain.model.RoundResolution;
import com.lottoharvest.domain.ports.RoundResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the authoritative resolvers in order and checks the answer against the calendar.
 *
 * <p>The calendar estimate stands in as the hint when the caller has none. A result
 * further than {@code maxDeviation} rounds from the estimate is kept but flagged.
 * The calendar only replaces the authorities when {@code fallbackToCalendar} is set.
 */
public class ReconcilingRoundResolver implements RoundResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReconcilingRoundResolver.class);

    private final List<RoundResolver> authorities;
    private final DateDerivedRoundResolver calendar;
    private final int maxDeviation;
    private final boolean fallbackToCalendar;

    public ReconcilingRoundResolver(List<RoundResolver> authorities, DateDerivedRoundResolver calendar,
                                    int maxDeviation, boolean fallbackToCalendar) {
        this.authorities = List.copyOf(authorities);
        this.calendar = calendar;
        this.maxDeviation = maxDeviation;
        this.fallbackToCalendar = fallbackToCalendar;
    }

    @Override
    public RoundResolution resolve(Integer hint) {
        int estimate = calendar.estimate();
        Integer effectiveHint = hint != null ? hint : estimate;

        RuntimeException lastFailure = null;
        for (RoundResolver authority : authorities) {
            try {
                RoundResolution resolution = authority.resolve(effectiveHint);
                return reconcile(resolution, estimate);
            } catch (RoundResolutionException | StructureNotFoundException e) {
                logger.warn("Round resolver '{}' failed: {}", authority.getStrategyName(), e.getMessage());
                lastFailure = e;
            }
        }

        if (fallbackToCalendar) {
            logger.warn("All round resolvers failed, falling back to calendar estimate {}", estimate);
            return new RoundResolution(estimate, calendar.getStrategyName(), estimate, false);
        }
        throw new RoundResolutionException("All round resolvers failed", lastFailure);
    }

    @Override
    public String getStrategyName() {
        return "reconciled";
    }

    private RoundResolution reconcile(RoundResolution resolution, int estimate) {
        boolean deviation = Math.abs(resolution.latestRound() - estimate) > maxDeviation;
        if (deviation) {
            logger.warn("Round deviation alarm: {} resolved {} but calendar estimates {}",
                resolution.strategy(), resolution.latestRound(), estimate);
        }
        return new RoundResolution(resolution.latestRound(), resolution.strategy(), estimate, deviation);
    }
}
