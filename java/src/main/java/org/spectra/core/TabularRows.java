package org.spectra.core;

import java.util.List;

/**
 * Delimited text split into a header and string rows.
 */
public class TabularRows {
    private final char delimiter;
    private final boolean hasHeader;
    private final List<String> header;
    private final List<List<String>> rows;

    public TabularRows(char delimiter, boolean hasHeader, List<String> header, List<List<String>> rows) {
        this.delimiter = delimiter;
        this.hasHeader = hasHeader;
        this.header = List.copyOf(header);
        this.rows = List.copyOf(rows);
    }

    public char getDelimiter() { return delimiter; }
    public boolean hasHeader() { return hasHeader; }
    public List<String> getHeader() { return header; }
    public List<List<String>> getRows() { return rows; }

    public int getRowCount() { return rows.size(); }

    /**
     * Widest row observed, or the header width when there are no rows.
     */
    public int getWidth() {
        int width = 0;
        for (List<String> row : rows) {
            width = Math.max(width, row.size());
        }
        return rows.isEmpty() ? header.size() : width;
    }

    public String columnName(int index) {
        return index < header.size() ? header.get(index) : "col_" + (index + 1);
    }

    public static String cellAt(List<String> row, int index) {
        return index < row.size() ? row.get(index) : "";
    }
}
