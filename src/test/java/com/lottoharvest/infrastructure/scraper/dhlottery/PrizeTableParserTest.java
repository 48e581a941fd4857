package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.exception.StructureNotFoundException;
import com.lottoharvest.domain.model.PrizeTierStat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PrizeTableParser.
 */
class PrizeTableParserTest {

    private static final String BY_WIN_PAGE = """
        <table class="tbl_data tbl_data_col">
          <thead>
            <tr><th>순위</th><th>등위별 총 당첨금액</th><th>당첨게임 수</th><th>1게임당 당첨금액</th><th>당첨기준</th><th>비고</th></tr>
          </thead>
          <tbody>
            <tr><td>1등</td><td>26,544,371,022원</td><td>13</td><td>2,041,874,694원</td><td>당첨번호 6개 숫자일치</td><td></td></tr>
            <tr><td>2등</td><td>4,424,061,870원</td><td>86</td><td>51,442,580원</td><td>당첨번호 5개 숫자일치 + 보너스 숫자일치</td><td></td></tr>
            <tr><td>3등</td><td>4,424,063,180원</td><td>3,110</td><td>1,422,528원</td><td>당첨번호 5개 숫자일치</td><td></td></tr>
            <tr><td>4등</td><td>7,719,340,000원</td><td>154,387</td><td>50,000원</td><td>당첨번호 4개 숫자일치</td><td></td></tr>
            <tr><td>5등</td><td>12,940,640,000원</td><td>2,588,128</td><td>5,000원</td><td>당첨번호 3개 숫자일치</td><td></td></tr>
          </tbody>
        </table>
        """;

    private final PrizeTableParser parser = new PrizeTableParser();

    @Test
    void testParsesRanksTwoToFive() {
        List<PrizeTierStat> stats = parser.parse(BY_WIN_PAGE);

        assertEquals(4, stats.size());
        PrizeTierStat second = stats.get(0);
        assertEquals(2, second.rank());
        assertEquals(4_424_061_870L, second.totalPrize());
        assertEquals(86, second.winners());
        assertEquals(51_442_580L, second.perGamePrize());
        assertEquals("당첨번호 5개 숫자일치 + 보너스 숫자일치", second.criteria());
        assertEquals(5, stats.get(3).rank());
        assertEquals(2_588_128L, stats.get(3).winners());
    }

    @Test
    void testSkipsTablesWithoutRanks() {
        String html = "<table class=\"tbl_data\"><tr><td>회차</td><td>1150</td></tr></table>"
            + "<table><tr><td>3</td><td>100원</td><td>2</td><td>50원</td></tr></table>";

        List<PrizeTierStat> stats = parser.parse(html);

        assertEquals(1, stats.size());
        assertEquals(3, stats.get(0).rank());
        assertNull(stats.get(0).criteria());
    }

    @Test
    void testFirstOccurrenceOfRankWins() {
        String html = "<table><tr><td>2등</td><td>10원</td><td>1</td><td>10원</td></tr>"
            + "<tr><td>2등</td><td>99원</td><td>9</td><td>11원</td></tr></table>";

        assertEquals(10L, parser.parse(html).get(0).totalPrize());
    }

    @Test
    void testNoPrizeTable() {
        assertThrows(StructureNotFoundException.class, () -> parser.parse("<html><body>점검 중</body></html>"));
        assertThrows(StructureNotFoundException.class, () -> parser.parse(null));
    }

    @Test
    void testScraperFetchesResultPageOfRound() throws Exception {
        DhLotteryEndpoints endpoints = DhLotteryEndpoints.defaults();
        ScriptedFetchClient client = new ScriptedFetchClient().answer(endpoints.byWinUrl(1150), BY_WIN_PAGE);

        List<PrizeTierStat> stats = new DhLotteryPrizeScraper(client, endpoints, parser).fetchPrizeBreakdown(1150);

        assertEquals(4, stats.size());
        assertEquals(List.of("https://dhlottery.co.kr/gameResult.do?method=byWin&drwNo=1150"), client.requestedUrls);
    }
}
