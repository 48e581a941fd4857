package com.lottoharvest.infrastructure.scraper.html;

import com.lottoharvest.domain.model.ColumnLayout;
import com.lottoharvest.domain.model.HeaderKeywords;
import com.lottoharvest.domain.model.Tier;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * A {@code <table>} found in a page, with the structural facts the locator scores it by.
 */
public class CandidateTable {

    /** Minimum score for a table to be picked without a label. */
    static final int MIN_SCORE = 4;

    private final int index;
    private final int position;
    private final Element element;
    private final List<String> headerTokens;
    private final List<Element> rows;
    private final int columnCount;
    private final int dataRowCount;

    CandidateTable(int index, int position, Element element, List<String> headerTokens,
                   List<Element> rows, int columnCount, int dataRowCount) {
        this.index = index;
        this.position = position;
        this.element = element;
        this.headerTokens = List.copyOf(headerTokens);
        this.rows = List.copyOf(rows);
        this.columnCount = columnCount;
        this.dataRowCount = dataRowCount;
    }

    /** Ordinal among the tables of the page. */
    public int getIndex() {
        return index;
    }

    /** Position of the table element in document order. */
    public int getPosition() {
        return position;
    }

    public Element getElement() {
        return element;
    }

    public List<String> getHeaderTokens() {
        return headerTokens;
    }

    /** The table's own rows, nested tables excluded. */
    public List<Element> getRows() {
        return rows;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public int getDataRowCount() {
        return dataRowCount;
    }

    public boolean hasHeader() {
        return !headerTokens.isEmpty();
    }

    public boolean hasAddressHeader() {
        return headerTokens.stream().anyMatch(t -> HeaderKeywords.containsAny(t, HeaderKeywords.ADDRESS));
    }

    public boolean hasNameHeader() {
        return headerTokens.stream().anyMatch(t -> HeaderKeywords.containsAny(t, HeaderKeywords.NAME));
    }

    public boolean hasClassificationHeader() {
        return headerTokens.stream().anyMatch(t -> HeaderKeywords.containsAny(t, HeaderKeywords.CLASSIFICATION));
    }

    /**
     * Heuristic fit of this table for a tier: header keywords, column-count class and
     * whether it holds data at all.
     */
    public int scoreFor(Tier tier) {
        int score = 0;
        if (hasNameHeader()) {
            score += 3;
        }
        if (hasAddressHeader()) {
            score += 3;
        }
        if (hasHeader()) {
            score += hasClassificationHeader() == tier.hasClassificationColumn() ? 2 : -2;
        }
        if (columnCount == tier.getMinColumns()) {
            score += 2;
        } else if (columnCount > tier.getMinColumns()) {
            score += 1;
        } else {
            score -= 3;
        }
        if (dataRowCount > 0) {
            score += 1;
        }
        return score;
    }

    /**
     * Structural signature check: enough columns, and when a header is present it names
     * an address column and carries a purchase-method column exactly when the tier does.
     */
    public boolean matchesShape(Tier tier) {
        if (columnCount < tier.getMinColumns()) {
            return false;
        }
        if (!hasHeader()) {
            return true;
        }
        return hasAddressHeader() && hasClassificationHeader() == tier.hasClassificationColumn();
    }

    /**
     * Column positions read from the header, or the tier's positional layout when the
     * header does not name both the store and the address column.
     */
    public ColumnLayout layout(Tier tier) {
        int label = indexOf(HeaderKeywords.NAME);
        int location = indexOf(HeaderKeywords.ADDRESS);
        if (label < 0 || location < 0) {
            return ColumnLayout.positional(tier);
        }
        int classification = tier.hasClassificationColumn()
            ? indexOf(HeaderKeywords.CLASSIFICATION)
            : ColumnLayout.UNKNOWN;
        return new ColumnLayout(label, classification, location);
    }

    private int indexOf(List<String> keywords) {
        for (int i = 0; i < headerTokens.size(); i++) {
            if (HeaderKeywords.containsAny(headerTokens.get(i), keywords)) {
                return i;
            }
        }
        return ColumnLayout.UNKNOWN;
    }

    @Override
    public String toString() {
        return "table#" + index + "[cols=" + columnCount + ", rows=" + dataRowCount + ", header=" + headerTokens + "]";
    }
}
