package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.HeaderKeywords;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates the tables of a page and measures each one.
 */
public final class TableScanner {

    private TableScanner() {
    }

    public static List<CandidateTable> scan(Document document) {
        Map<Element, Integer> positions = positions(document);
        List<CandidateTable> out = new ArrayList<>();
        int index = 0;
        for (Element table : document.getElementsByTag("table")) {
            out.add(measure(index++, positions.get(table), table));
        }
        return out;
    }

    /** Document-order position of every element, used to tell what follows what. */
    static Map<Element, Integer> positions(Document document) {
        Map<Element, Integer> positions = new IdentityHashMap<>();
        Elements all = document.getAllElements();
        for (int i = 0; i < all.size(); i++) {
            positions.put(all.get(i), i);
        }
        return positions;
    }

    private static CandidateTable measure(int index, int position, Element table) {
        List<Element> rows = ownRows(table);
        List<String> header = List.of();
        Element headerRow = null;
        for (Element row : rows) {
            List<Element> th = cells(row, "th");
            if (!th.isEmpty() && cells(row, "td").isEmpty()) {
                header = texts(th);
                headerRow = row;
                break;
            }
        }
        if (headerRow == null && !rows.isEmpty()) {
            Element first = rows.get(0);
            if (HeaderKeywords.isHeaderSignature(first.text())) {
                header = texts(cells(first, "td"));
                headerRow = first;
            }
        }

        int columnCount = header.size();
        int dataRows = 0;
        for (Element row : rows) {
            if (row == headerRow) {
                continue;
            }
            int tdCount = cells(row, "td").size();
            if (tdCount >= 2) {
                dataRows++;
            }
            columnCount = Math.max(columnCount, tdCount);
        }
        return new CandidateTable(index, position, table, header, rows, columnCount, dataRows);
    }

    /**
     * Rows belonging to this table itself, skipping rows of nested tables.
     */
    static List<Element> ownRows(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            String tag = child.tagName();
            if (tag.equals("tr")) {
                rows.add(child);
            } else if (tag.equals("thead") || tag.equals("tbody") || tag.equals("tfoot")) {
                for (Element row : child.children()) {
                    if (row.tagName().equals("tr")) {
                        rows.add(row);
                    }
                }
            }
        }
        return rows;
    }

    /** Direct cell children of a row with the given tag. */
    static List<Element> cells(Element row, String tag) {
        List<Element> out = new ArrayList<>();
        for (Element child : row.children()) {
            if (child.tagName().equals(tag)) {
                out.add(child);
            }
        }
        return out;
    }

    private static List<String> texts(List<Element> cells) {
        List<String> out = new ArrayList<>();
        for (Element cell : cells) {
            out.add(cell.text());
        }
        return out;
    }
}
