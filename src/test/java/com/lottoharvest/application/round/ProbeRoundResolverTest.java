package com.lottoharvest.application.round;

import com.lottoharvest.domain.exception.RoundResolutionException;
import com.lottoharvest.domain.model.ProbeResult;
import com.lottoharvest.domain.model.RoundResolution;
import com.lottoharvest.domain.ports.RoundProbe;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProbeRoundResolver.
 */
class ProbeRoundResolverTest {

    @Test
    void testFindsLatestRoundFromHintBelowIt() {
        CountingProbe probe = new CountingProbe(1300);
        ProbeRoundResolver resolver = new ProbeRoundResolver(probe, 10000, 1000);

        RoundResolution resolution = resolver.resolve(1290);

        assertEquals(1300, resolution.latestRound());
        assertEquals(ProbeRoundResolver.STRATEGY, resolution.strategy());
    }

    @Test
    void testFindsLatestRoundFromHintAboveIt() {
        CountingProbe probe = new CountingProbe(1300);
        ProbeRoundResolver resolver = new ProbeRoundResolver(probe, 10000, 1000);

        assertEquals(1300, resolver.resolve(1500).latestRound());
    }

    @Test
    void testHintEqualToLatest() {
        ProbeRoundResolver resolver = new ProbeRoundResolver(new CountingProbe(1300), 10000, 1000);

        assertEquals(1300, resolver.resolve(1300).latestRound());
    }

    @Test
    void testUsesDefaultHintWhenNoneGiven() {
        CountingProbe probe = new CountingProbe(1152);
        ProbeRoundResolver resolver = new ProbeRoundResolver(probe, 10000, 1150);

        assertEquals(1152, resolver.resolve(null).latestRound());
        assertEquals(1150, probe.probed.get(0));
    }

    @Test
    void testConvergesOnEveryBoundary() {
        for (int latest = 1; latest <= 70; latest++) {
            for (int hint = 1; hint <= 80; hint += 7) {
                ProbeRoundResolver resolver = new ProbeRoundResolver(new CountingProbe(latest), 10000, 1);
                assertEquals(latest, resolver.resolve(hint).latestRound(),
                    "latest " + latest + " from hint " + hint);
            }
        }
    }

    @Test
    void testProbeCountIsLogarithmic() {
        CountingProbe probe = new CountingProbe(1300);
        new ProbeRoundResolver(probe, 10000, 1).resolve(1290);

        // one probe of the hint, one of 2*hint, then a binary search over 1290 rounds
        assertTrue(probe.probed.size() <= 2 + 11 + 1, "probes: " + probe.probed.size());
    }

    @Test
    void testStopsAtCeiling() {
        CountingProbe probe = new CountingProbe(Integer.MAX_VALUE);
        ProbeRoundResolver resolver = new ProbeRoundResolver(probe, 2000, 1000);

        assertEquals(2000, resolver.resolve(1500).latestRound());
        assertTrue(probe.probed.stream().allMatch(r -> r <= 2000));
    }

    @Test
    void testUnknownProbeAbortsInsteadOfReportingStaleRound() {
        RoundProbe flaky = round -> round > 1295 ? ProbeResult.UNKNOWN : ProbeResult.EXISTS;
        ProbeRoundResolver resolver = new ProbeRoundResolver(flaky, 10000, 1000);

        assertThrows(RoundResolutionException.class, () -> resolver.resolve(1290));
    }

    @Test
    void testNoPublishedRoundAtAll() {
        ProbeRoundResolver resolver = new ProbeRoundResolver(round -> ProbeResult.ABSENT, 10000, 1000);

        assertThrows(RoundResolutionException.class, () -> resolver.resolve(50));
    }

    /**
     * Probe over a source publishing rounds 1..latest, recording every round asked.
     */
    private static class CountingProbe implements RoundProbe {
        private final int latest;
        private final List<Integer> probed = new ArrayList<>();

        CountingProbe(int latest) {
            this.latest = latest;
        }

        @Override
        public ProbeResult probe(int round) {
            probed.add(round);
            return round >= 1 && round <= latest ? ProbeResult.EXISTS : ProbeResult.ABSENT;
        }
    }
}
