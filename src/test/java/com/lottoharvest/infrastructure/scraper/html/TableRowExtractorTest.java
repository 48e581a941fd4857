package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.RawRow;
import com.lottoharvest.domain.model.Tier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TableRowExtractor.
 */
class TableRowExtractorTest {

    private final TableRowExtractor extractor = new TableRowExtractor();

    private static CandidateTable only(String html) {
        Document doc = Jsoup.parse(html);
        return TableScanner.scan(doc).get(0);
    }

    @Test
    void testSkipsHeaderRow() {
        CandidateTable table = only("""
            <table>
              <tr><th>번호</th><th>상호명</th><th>소재지</th></tr>
              <tr><td>1</td><td>대박상회</td><td>부산 해운대구 우동 2</td></tr>
              <tr><td>2</td><td>로또명당</td><td>대구 중구 동성로 3</td></tr>
            </table>
            """);

        List<RawRow> rows = extractor.extract(table, Tier.SECOND);

        assertEquals(2, rows.size());
        assertEquals(RawRow.of("1", "대박상회", "부산 해운대구 우동 2"), rows.get(0));
    }

    @Test
    void testStackedTableStopsAtNextTierLabel() {
        CandidateTable table = only("""
            <table>
              <tr><th>번호</th><th>상호명</th><th>구분</th><th>소재지</th></tr>
              <tr><td colspan="4">1등 배출점</td></tr>
              <tr><td>1</td><td>행운복권</td><td>자동</td><td>서울 강남구 테헤란로 1</td></tr>
              <tr><td>2</td><td>복권나라</td><td>수동</td><td>인천 남동구 구월동 5</td></tr>
              <tr><td colspan="4">2등 배출점</td></tr>
              <tr><td>1</td><td>대박상회</td><td></td><td>부산 해운대구 우동 2</td></tr>
            </table>
            """);

        List<RawRow> first = extractor.extract(table, Tier.FIRST);
        List<RawRow> second = extractor.extract(table, Tier.SECOND);

        assertEquals(2, first.size());
        assertEquals("복권나라", first.get(1).cell(1));
        assertEquals(1, second.size());
        assertEquals("대박상회", second.get(0).cell(1));
    }

    @Test
    void testLeadingOtherTierLabelYieldsNothing() {
        CandidateTable table = only("""
            <table>
              <tr><td colspan="3">2등 배출점</td></tr>
              <tr><td>1</td><td>대박상회</td><td>부산 해운대구 우동 2</td></tr>
            </table>
            """);

        assertTrue(extractor.extract(table, Tier.FIRST).isEmpty());
    }

    @Test
    void testLongRowMentioningLabelIsData() {
        Document doc = Jsoup.parse("<table><tr><td>1</td><td>2등 배출점 최다 판매점으로 전국에 널리 알려진 로또명당 본점입니다</td>"
            + "<td>대구 중구 동성로 3</td></tr></table>");

        assertNull(TableRowExtractor.labelOf(doc.select("tr").first()));
    }

    @Test
    void testStoreNamedAfterOtherTierIsData() {
        CandidateTable table = only("""
            <table>
              <tr><th>번호</th><th>상호명</th><th>소재지</th></tr>
              <tr><td>1</td><td>대박상회</td><td>부산 해운대구 우동 2</td></tr>
              <tr><td>2</td><td>로또1등배출점</td><td>대구 중구 동성로 3</td></tr>
              <tr><td>3</td><td>명당복권</td><td>대구 중구 3</td></tr>
            </table>
            """);

        List<RawRow> rows = extractor.extract(table, Tier.SECOND);

        assertEquals(3, rows.size());
        assertEquals("로또1등배출점", rows.get(1).cell(1));
    }
}
