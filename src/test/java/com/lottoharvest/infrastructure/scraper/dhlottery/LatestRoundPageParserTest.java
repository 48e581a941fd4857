package com.lottoharvest.infrastructure.scraper.dhlottery;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LatestRoundPageParser.
 */
class LatestRoundPageParserTest {

    @Test
    void testScriptVariable() {
        assertEquals(OptionalInt.of(1150),
            LatestRoundPageParser.parse("<script>var lottoDrwNo = 1150;</script><h4>1149회 당첨결과</h4>"));
    }

    @Test
    void testHiddenInput() {
        assertEquals(OptionalInt.of(1150),
            LatestRoundPageParser.parse("<input type=\"hidden\" id=\"lottoDrwNo\" value=\"1150\">"));
    }

    @Test
    void testResultHeading() {
        assertEquals(OptionalInt.of(1150),
            LatestRoundPageParser.parse("<div class=\"win_result\"><h4><strong>1150회</strong> 당첨결과</h4></div>"));
    }

    @Test
    void testNoMarker() {
        assertTrue(LatestRoundPageParser.parse("<html><body>점검 중</body></html>").isEmpty());
        assertTrue(LatestRoundPageParser.parse(null).isEmpty());
    }
}
