package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.exception.StructureNotFoundException;
import com.lottoharvest.domain.model.PrizeTierStat;
import com.lottoharvest.infrastructure.normalize.NormalizationUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses ranks 2 to 5 of the prize table on a results-by-win page.
 *
 * <p>Columns read: rank, total prize, winning games, prize per game, criteria. Money and
 * count cells keep their digits only. Tables are tried from the most specific selector
 * to any table; the first yielding a rank wins.
 */
public class PrizeTableParser {

    private static final Logger logger = LoggerFactory.getLogger(PrizeTableParser.class);

    private static final List<String> TABLE_SELECTORS = List.of("table.tbl_data", "table.tbl_data_col", "table");
    private static final Pattern RANK = Pattern.compile("([2-5])\\s*등");
    private static final Pattern BARE_RANK = Pattern.compile("[2-5]");

    public List<PrizeTierStat> parse(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        Set<Element> tables = new LinkedHashSet<>();
        for (String selector : TABLE_SELECTORS) {
            tables.addAll(document.select(selector));
        }
        for (Element table : tables) {
            List<PrizeTierStat> stats = parseTable(table);
            if (!stats.isEmpty()) {
                return stats;
            }
        }
        throw new StructureNotFoundException("No rank 2-5 prize rows found");
    }

    private static List<PrizeTierStat> parseTable(Element table) {
        TreeMap<Integer, PrizeTierStat> byRank = new TreeMap<>();
        for (Element row : table.select("tr")) {
            Elements tds = row.select("td");
            if (tds.isEmpty()) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            for (Element td : tds) {
                cells.add(NormalizationUtils.cleanText(td.text()));
            }
            Integer rank = rankOf(cells.get(0));
            if (rank == null || byRank.containsKey(rank)) {
                continue;
            }
            try {
                byRank.put(rank, new PrizeTierStat(
                    rank,
                    cells.size() > 1 ? NormalizationUtils.digitsOnly(cells.get(1)) : 0L,
                    cells.size() > 2 ? NormalizationUtils.digitsOnly(cells.get(2)) : 0L,
                    cells.size() > 3 ? NormalizationUtils.digitsOnly(cells.get(3)) : 0L,
                    cells.size() > 4 ? cells.get(4) : null));
            } catch (NumberFormatException e) {
                logger.warn("Skipping rank {} prize row: {}", rank, e.getMessage());
            }
        }
        return new ArrayList<>(byRank.values());
    }

    private static Integer rankOf(String cell) {
        Matcher m = RANK.matcher(cell);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        if (BARE_RANK.matcher(cell).matches()) {
            return Integer.parseInt(cell);
        }
        return null;
    }
}
