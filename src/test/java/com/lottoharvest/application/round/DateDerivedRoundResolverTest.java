package com.lottoharvest.application.round;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DateDerivedRoundResolver.
 */
class DateDerivedRoundResolverTest {

    private static final OffsetDateTime ANCHOR = OffsetDateTime.parse("2024-12-28T00:00+09:00");
    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    private static DateDerivedRoundResolver at(String kst) {
        Instant now = OffsetDateTime.parse(kst).toInstant();
        return new DateDerivedRoundResolver(Clock.fixed(now, ZoneOffset.UTC), 1152, ANCHOR,
            DayOfWeek.SATURDAY, 21, SEOUL);
    }

    @Test
    void testAnchorDayAfterPublishHour() {
        assertEquals(1152, at("2024-12-28T21:30+09:00").estimate());
    }

    @Test
    void testAnchorDayBeforePublishHour() {
        assertEquals(1151, at("2024-12-28T20:00+09:00").estimate());
    }

    @Test
    void testMidWeek() {
        assertEquals(1152, at("2025-01-03T12:00+09:00").estimate());
    }

    @Test
    void testNextDrawDayBeforeAndAfterPublishHour() {
        assertEquals(1152, at("2025-01-04T10:00+09:00").estimate());
        assertEquals(1153, at("2025-01-04T22:00+09:00").estimate());
    }

    @Test
    void testClockZoneDoesNotMatter() {
        // 13:00 UTC is 22:00 in Seoul
        DateDerivedRoundResolver resolver = new DateDerivedRoundResolver(
            Clock.fixed(Instant.parse("2025-01-04T13:00:00Z"), ZoneId.of("America/New_York")),
            1152, ANCHOR, DayOfWeek.SATURDAY, 21, SEOUL);

        assertEquals(1153, resolver.estimate());
    }

    @Test
    void testIdempotentForFixedClock() {
        DateDerivedRoundResolver resolver = at("2025-06-10T09:00+09:00");

        assertEquals(resolver.estimate(), resolver.estimate());
        assertEquals(resolver.resolve(null), resolver.resolve(999));
        assertEquals(DateDerivedRoundResolver.STRATEGY, resolver.resolve(null).strategy());
    }

    @Test
    void testNeverBelowRoundOne() {
        assertEquals(1, at("1990-01-01T00:00+09:00").estimate());
    }
}
