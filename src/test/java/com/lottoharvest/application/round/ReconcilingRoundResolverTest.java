package com.lottoharvest.application.round;

import com.lottoharvest.domain.exception.RoundResolutionException;
import com.lottoharvest.domain.exception.StructureNotFoundException;
import com.lottoharvest.domain.model.RoundResolution;
import com.lottoharvest.domain.ports.RoundResolver;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReconcilingRoundResolver.
 */
class ReconcilingRoundResolverTest {

    /** Calendar fixed mid-week so that it estimates round 1152. */
    private final DateDerivedRoundResolver calendar = new DateDerivedRoundResolver(
        Clock.fixed(OffsetDateTime.parse("2025-01-01T12:00+09:00").toInstant(), ZoneOffset.UTC),
        1152, OffsetDateTime.parse("2024-12-28T00:00+09:00"), DayOfWeek.SATURDAY, 21, ZoneId.of("Asia/Seoul"));

    @Test
    void testAgreeingAuthorityIsNotFlagged() {
        FixedResolver probe = new FixedResolver("probe", 1152);
        ReconcilingRoundResolver resolver = new ReconcilingRoundResolver(List.of(probe), calendar, 1, false);

        RoundResolution resolution = resolver.resolve(null);

        assertEquals(1152, resolution.latestRound());
        assertEquals("probe", resolution.strategy());
        assertEquals(1152, resolution.dateEstimate());
        assertFalse(resolution.deviation());
    }

    @Test
    void testEstimateIsUsedAsHintWhenNoneGiven() {
        FixedResolver probe = new FixedResolver("probe", 1152);
        new ReconcilingRoundResolver(List.of(probe), calendar, 1, false).resolve(null);

        assertEquals(1152, probe.lastHint);
    }

    @Test
    void testCallerHintWins() {
        FixedResolver probe = new FixedResolver("probe", 1152);
        new ReconcilingRoundResolver(List.of(probe), calendar, 1, false).resolve(1140);

        assertEquals(1140, probe.lastHint);
    }

    @Test
    void testDeviationBeyondToleranceIsFlaggedButKept() {
        FixedResolver probe = new FixedResolver("probe", 1156);
        RoundResolution resolution = new ReconcilingRoundResolver(List.of(probe), calendar, 1, false).resolve(null);

        assertEquals(1156, resolution.latestRound());
        assertTrue(resolution.deviation());
    }

    @Test
    void testDeviationWithinToleranceIsNotFlagged() {
        FixedResolver probe = new FixedResolver("probe", 1153);
        RoundResolution resolution = new ReconcilingRoundResolver(List.of(probe), calendar, 1, false).resolve(null);

        assertFalse(resolution.deviation());
    }

    @Test
    void testFallsThroughToNextAuthority() {
        RoundResolver page = new FailingResolver("page", new StructureNotFoundException("no marker"));
        FixedResolver probe = new FixedResolver("probe", 1152);

        RoundResolution resolution = new ReconcilingRoundResolver(List.of(page, probe), calendar, 1, false)
            .resolve(null);

        assertEquals("probe", resolution.strategy());
    }

    @Test
    void testAllAuthoritiesFailing() {
        RoundResolver probe = new FailingResolver("probe", new RoundResolutionException("probe failed"));
        ReconcilingRoundResolver resolver = new ReconcilingRoundResolver(List.of(probe), calendar, 1, false);

        assertThrows(RoundResolutionException.class, () -> resolver.resolve(null));
    }

    @Test
    void testCalendarFallbackWhenEnabled() {
        RoundResolver probe = new FailingResolver("probe", new RoundResolutionException("probe failed"));
        RoundResolution resolution = new ReconcilingRoundResolver(List.of(probe), calendar, 1, true).resolve(null);

        assertEquals(1152, resolution.latestRound());
        assertEquals(DateDerivedRoundResolver.STRATEGY, resolution.strategy());
    }

    private static class FixedResolver implements RoundResolver {
        private final String name;
        private final int round;
        private Integer lastHint;

        FixedResolver(String name, int round) {
            this.name = name;
            this.round = round;
        }

        @Override
        public RoundResolution resolve(Integer hint) {
            lastHint = hint;
            return RoundResolution.of(round, name);
        }

        @Override
        public String getStrategyName() {
            return name;
        }
    }

    private static class FailingResolver implements RoundResolver {
        private final String name;
        private final RuntimeException failure;

        FailingResolver(String name, RuntimeException failure) {
            this.name = name;
            this.failure = failure;
        }

        @Override
        public RoundResolution resolve(Integer hint) {
            throw failure;
        }

        @Override
        public String getStrategyName() {
            return name;
        }
    }
}
