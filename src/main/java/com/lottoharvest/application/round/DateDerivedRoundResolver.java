package com.lottoharvest.application.round;

import com.lottoharvest.domain.model.RoundResolution;
import com.lottoharvest.domain.ports.RoundResolver;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Computes the latest round from the calendar: one round per week since a known anchor.
 *
 * <p>The anchor timestamp should be the start of the anchor round's draw day, so that
 * the draw day itself counts as a new week and the publish-hour check takes the round
 * back off until results are out. No network calls; drifts if the cadence or publish
 * hour ever change upstream.
 */
public class DateDerivedRoundResolver implements RoundResolver {

    public static final String STRATEGY = "date";

    private static final long WEEK_SECONDS = Duration.ofDays(7).getSeconds();

    private final Clock clock;
    private final int anchorRound;
    private final OffsetDateTime anchorTime;
    private final DayOfWeek drawDay;
    private final int publishHour;
    private final ZoneId zone;

    public DateDerivedRoundResolver(Clock clock, int anchorRound, OffsetDateTime anchorTime,
                                    DayOfWeek drawDay, int publishHour, ZoneId zone) {
        this.clock = clock;
        this.anchorRound = anchorRound;
        this.anchorTime = anchorTime;
        this.drawDay = drawDay;
        this.publishHour = publishHour;
        this.zone = zone;
    }

    /**
     * Estimated latest round at the clock's current instant.
     */
    public int estimate() {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        long elapsedSeconds = Duration.between(anchorTime.toInstant(), now.toInstant()).getSeconds();
        long elapsedWeeks = Math.floorDiv(elapsedSeconds, WEEK_SECONDS);

        long candidate = anchorRound + elapsedWeeks;
        if (now.getDayOfWeek() == drawDay && now.getHour() < publishHour) {
            candidate -= 1;
        }
        return (int) Math.max(1, candidate);
    }

    @Override
    public RoundResolution resolve(Integer hint) {
        return RoundResolution.of(estimate(), STRATEGY);
    }

    @Override
    public String getStrategyName() {
        return STRATEGY;
    }
}
