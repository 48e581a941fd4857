package com.lottoharvest.domain.model;

import java.util.List;

/**
 * Ordered cell texts of one table line, as found on the page.
 */
public record RawRow(List<String> cells) {

    public RawRow {
        cells = List.copyOf(cells);
    }

    public static RawRow of(String... cells) {
        return new RawRow(List.of(cells));
    }

    public int size() {
        return cells.size();
    }

    /** Returns the cell at {@code index}, or an empty string when out of range. */
    public String cell(int index) {
        if (index < 0 || index >= cells.size()) {
            return "";
        }
        String value = cells.get(index);
        return value == null ? "" : value;
    }

    public String joined() {
        return String.join(" ", cells);
    }
}
