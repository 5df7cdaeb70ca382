package org.spectra.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectra.core.*;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reader for delimited text exports (CSV, TSV, semicolon, pipe, whitespace).
 */
public class DelimitedTextReader {
    private static final Logger log = LoggerFactory.getLogger(DelimitedTextReader.class);

    private static final Pattern UNIT_IN_LABEL = Pattern.compile("\\(([^)]+)\\)|\\[([^\\]]+)]");

    /**
     * Tokenize the data body of {@code text} into a header and rows.
     *
     * @param maxRows stop after this many data rows; 0 or less reads everything
     */
    public TabularRows tabulate(String text, int maxRows) {
        String body = PreambleExtractor.stripForTabulation(text);
        DialectSniffer.Dialect dialect = DialectSniffer.sniff(body);
        char delimiter = dialect.getDelimiter();

        List<String> header = new ArrayList<>();
        boolean headerTaken = false;
        List<List<String>> rows = new ArrayList<>();

        for (String line : body.split("\n", -1)) {
            List<String> cells = RowTokenizer.split(line, delimiter);
            if (isBlank(cells)) continue;

            if (dialect.hasHeader() && !headerTaken) {
                for (int i = 0; i < cells.size(); i++) {
                    String name = cells.get(i).strip();
                    header.add(name.isEmpty() ? "col_" + (i + 1) : name);
                }
                headerTaken = true;
                continue;
            }

            List<String> row = new ArrayList<>(cells.size());
            for (String cell : cells) row.add(cell.strip());
            rows.add(row);
            if (maxRows > 0 && rows.size() >= maxRows) break;
        }

        if (header.isEmpty()) {
            int width = 0;
            for (List<String> row : rows) width = Math.max(width, row.size());
            for (int i = 0; i < width; i++) header.add("col_" + (i + 1));
        }

        log.debug("Tabulated {} rows, {} header columns, delimiter '{}'",
            rows.size(), header.size(), DialectSniffer.printable(delimiter));
        return new TabularRows(delimiter, dialect.hasHeader(), header, rows);
    }

    /**
     * Column inventory over every parsed row.
     */
    public List<ColumnInfo> classifyColumns(TabularRows table) {
        int width = table.getWidth();
        List<ColumnInfo> columns = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            List<CellValue> cells = new ArrayList<>(table.getRowCount());
            for (List<String> row : table.getRows()) {
                cells.add(CellValue.of(TabularRows.cellAt(row, i)));
            }
            columns.add(ColumnInfo.classify(i, table.columnName(i), cells));
        }
        return columns;
    }

    /**
     * The first two numeric columns become X and Y. Extra numeric columns
     * are an ambiguity for the caller to resolve, reported with what the
     * column names suggest.
     */
    public AxisSuggestion suggestAxes(List<ColumnInfo> columns, List<String> warnings) {
        List<Integer> numeric = new ArrayList<>();
        for (ColumnInfo c : columns) {
            if (c.isNumeric()) numeric.add(c.getIndex());
        }

        if (numeric.size() >= 2) {
            if (numeric.size() > 2) {
                String message = "Multiple numeric columns detected; please confirm X/Y columns before ingest.";
                AxisSuggestion hinted = AxisHintScorer.suggest(columns);
                if (hinted.isComplete()
                        && (!hinted.getXIndex().equals(numeric.get(0)) || !hinted.getYIndex().equals(numeric.get(1)))) {
                    message += String.format(" Column names suggest X='%s' and Y='%s'.",
                        columns.get(hinted.getXIndex()).getName(), columns.get(hinted.getYIndex()).getName());
                }
                warnings.add(message);
            }
            return new AxisSuggestion(numeric.get(0), numeric.get(1));
        }
        if (numeric.size() == 1) {
            warnings.add("Only one fully-numeric column detected in preview; "
                + "file may be messy or require manual mapping.");
            return new AxisSuggestion(numeric.get(0), null);
        }
        warnings.add("No fully-numeric columns detected in preview; "
            + "file may be non-tabular or include units/headers in data rows.");
        return AxisSuggestion.none();
    }

    /**
     * Numeric X/Y pairs from two columns. Rows where either cell is empty or
     * not a number are skipped and counted.
     */
    public XYColumns extractXY(TabularRows table, int xIndex, int yIndex) {
        double[] x = new double[table.getRowCount()];
        double[] y = new double[table.getRowCount()];
        int n = 0;
        int skipped = 0;
        for (List<String> row : table.getRows()) {
            CellValue xs = CellValue.of(TabularRows.cellAt(row, xIndex));
            CellValue ys = CellValue.of(TabularRows.cellAt(row, yIndex));
            if (!xs.isNumeric() || !ys.isNumeric()) {
                skipped++;
                continue;
            }
            x[n] = xs.getNumber();
            y[n] = ys.getNumber();
            n++;
        }
        return new XYColumns(Arrays.copyOf(x, n), Arrays.copyOf(y, n), skipped);
    }

    /**
     * Unit written in parentheses or brackets inside a header label, e.g.
     * {@code "Wavelength (nm)"}.
     */
    public static String extractUnit(String headerCell) {
        if (headerCell == null) return null;
        Matcher m = UNIT_IN_LABEL.matcher(headerCell);
        if (!m.find()) return null;
        String unit = m.group(1) != null ? m.group(1) : m.group(2);
        unit = unit == null ? "" : unit.strip();
        return unit.isEmpty() ? null : unit;
    }

    private static boolean isBlank(List<String> cells) {
        for (String cell : cells) {
            if (!cell.isBlank()) return false;
        }
        return true;
    }
}
