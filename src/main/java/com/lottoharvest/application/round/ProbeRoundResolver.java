package com.lottoharvest.application.round;

import com.lottoharvest.domain.exception.RoundResolutionException;
import com.lottoharvest.domain.model.ProbeResult;
import com.lottoharvest.domain.model.RoundResolution;
import com.lottoharvest.domain.ports.RoundProbe;
import com.lottoharvest.domain.ports.RoundResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the latest round by probing, relying on "round N exists" being true up to the
 * latest round and false above it.
 *
 * <p>From the hint the upper bound is doubled while rounds keep existing, then the
 * boundary is binary-searched. A hint above the latest round is searched downward
 * from round 1. Any probe that comes back {@link ProbeResult#UNKNOWN} aborts the
 * search with a {@link RoundResolutionException}, so a transport failure can never be
 * mistaken for the end of the published range.
 */
public class ProbeRoundResolver implements RoundResolver {

    public static final String STRATEGY = "probe";

    private static final Logger logger = LoggerFactory.getLogger(ProbeRoundResolver.class);

    private final RoundProbe probe;
    private final int ceiling;
    private final int defaultHint;

    /**
     * @param probe       existence oracle
     * @param ceiling     sanity bound on any round index probed
     * @param defaultHint starting point when the caller has no hint
     */
    public ProbeRoundResolver(RoundProbe probe, int ceiling, int defaultHint) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("ceiling must be positive");
        }
        this.probe = probe;
        this.ceiling = ceiling;
        this.defaultHint = Math.max(1, Math.min(defaultHint, ceiling));
    }

    @Override
    public RoundResolution resolve(Integer hint) {
        int start = (hint != null && hint > 0) ? Math.min(hint, ceiling) : defaultHint;
        logger.debug("Probing for latest round starting at {}", start);

        int latest = exists(start) ? searchUpward(start) : searchBelow(start);

        logger.info("Probe resolved latest round {} (hint {})", latest, hint);
        return RoundResolution.of(latest, STRATEGY);
    }

    @Override
    public String getStrategyName() {
        return STRATEGY;
    }

    private int searchUpward(int start) {
        int lo = start;
        long hi = 2L * start;

        while (true) {
            if (hi > ceiling) {
                hi = ceiling;
            }
            if (hi <= lo) {
                logger.warn("Round {} still exists at the probe ceiling", lo);
                return lo;
            }
            if (!exists((int) hi)) {
                break;
            }
            lo = (int) hi;
            hi *= 2;
        }
        return lastExisting(lo, (int) hi);
    }

    private int searchBelow(int start) {
        if (start == 1 || !exists(1)) {
            throw new RoundResolutionException("Source reports no published round at all");
        }
        return lastExisting(1, start);
    }

    /**
     * Binary search over [lo, hi] where lo exists and hi does not.
     */
    private int lastExisting(int lo, int hi) {
        while (lo + 1 < hi) {
            int mid = lo + (hi - lo) / 2;
            if (exists(mid)) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private boolean exists(int round) {
        ProbeResult result = probe.probe(round);
        return switch (result) {
            case EXISTS -> true;
            case ABSENT -> false;
            case UNKNOWN -> throw new RoundResolutionException("Probe of round " + round + " failed");
        };
    }
}
