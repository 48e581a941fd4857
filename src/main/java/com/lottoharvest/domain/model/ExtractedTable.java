package com.lottoharvest.domain.model;

import java.util.List;

/**
 * Raw rows pulled out of the table a section resolved to, plus the column layout
 * its header implied.
 */
public record ExtractedTable(ColumnLayout layout, List<RawRow> rows) {

    public ExtractedTable {
        rows = List.copyOf(rows);
    }
}
