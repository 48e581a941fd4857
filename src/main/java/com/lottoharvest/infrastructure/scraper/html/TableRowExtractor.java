package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.RawRow;
import com.lottoharvest.domain.model.Tier;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the data rows of a located table for one tier.
 *
 * <p>If the table stacks several tiers, each introduced by a label row, only the rows
 * after this tier's label are read, up to the first row labeling another tier. Rows
 * without {@code td} cells (header rows) are skipped.
 */
public class TableRowExtractor {

    public List<RawRow> extract(CandidateTable table, Tier tier) {
        List<Element> rows = table.getRows();
        int start = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (labelOf(rows.get(i)) == tier) {
                start = i + 1;
                break;
            }
        }

        List<RawRow> out = new ArrayList<>();
        for (int i = start; i < rows.size(); i++) {
            Element row = rows.get(i);
            Tier label = labelOf(row);
            if (label != null && label != tier) {
                break;
            }
            if (label == tier) {
                continue;
            }
            List<Element> cells = TableScanner.cells(row, "td");
            if (cells.isEmpty()) {
                continue;
            }
            List<String> texts = new ArrayList<>(cells.size());
            for (Element cell : cells) {
                texts.add(cell.text());
            }
            out.add(new RawRow(texts));
        }
        return out;
    }

    /**
     * The tier a row announces, or null for ordinary rows. A label row is short and has at
     * most one non-empty cell, so a store named after a tier label does not end the section.
     */
    static Tier labelOf(Element row) {
        String text = row.text();
        if (text.length() > 40 || filledCells(row) > 1) {
            return null;
        }
        for (Tier tier : Tier.values()) {
            if (tier.isLabeledBy(text)) {
                return tier;
            }
        }
        return null;
    }

    /**
     * True when the element is, or sits in, a data cell: the nearest cell holds no nested
     * table and its row has other non-empty cells.
     */
    static boolean isInDataCell(Element element) {
        for (Element current = element; current != null; current = current.parent()) {
            String tag = current.tagName();
            if (tag.equals("td") || tag.equals("th")) {
                if (current.select("table").size() > 0) {
                    return false;
                }
                Element row = current.parent();
                return row != null && filledCells(row) > 1;
            }
        }
        return false;
    }

    private static int filledCells(Element row) {
        int filled = 0;
        for (Element cell : row.children()) {
            String tag = cell.tagName();
            if ((tag.equals("td") || tag.equals("th")) && !cell.text().isBlank()) {
                filled++;
            }
        }
        return filled;
    }
}
