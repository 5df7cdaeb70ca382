package org.spectra.core;

/**
 * Inventory entry for one column of a table.
 */
public class ColumnInfo {
    private final int index;
    private final String name;
    private final boolean numeric;
    private final int nonNumericCount;

    public ColumnInfo(int index, String name, boolean numeric, int nonNumericCount) {
        this.index = index;
        this.name = name;
        this.numeric = numeric;
        this.nonNumericCount = nonNumericCount;
    }

    /**
     * Classify a column from its cells. A column is numeric only if it has at
     * least one non-empty cell and every non-empty cell is numeric.
     */
    public static ColumnInfo classify(int index, String name, Iterable<CellValue> cells) {
        boolean seenAny = false;
        int failures = 0;
        for (CellValue cell : cells) {
            if (cell.isEmpty()) continue;
            seenAny = true;
            if (!cell.isNumeric()) failures++;
        }
        return new ColumnInfo(index, name, seenAny && failures == 0, failures);
    }

    public int getIndex() { return index; }
    public String getName() { return name; }
    public boolean isNumeric() { return numeric; }
    public int getNonNumericCount() { return nonNumericCount; }

    @Override
    public String toString() {
        return String.format("ColumnInfo(%d, %s, numeric=%s, failures=%d)",
            index, name, numeric, nonNumericCount);
    }
}
