package org.spectra.io;

import org.junit.jupiter.api.Test;
import org.spectra.core.AxisSuggestion;
import org.spectra.core.ColumnInfo;
import org.spectra.core.TabularRows;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DelimitedTextReaderTest {

    private final DelimitedTextReader reader = new DelimitedTextReader();

    @Test
    void tabulates_header_and_rows() {
        TabularRows table = reader.tabulate("wavelength (nm),flux\n400,1.5\n401,1.7\n\n402,1.9\n", 0);

        assertEquals(',', table.getDelimiter());
        assertTrue(table.hasHeader());
        assertEquals(List.of("wavelength (nm)", "flux"), table.getHeader());
        assertEquals(3, table.getRowCount());
        assertEquals(List.of("402", "1.9"), table.getRows().get(2));
    }

    @Test
    void max_rows_bounds_the_preview() {
        TabularRows table = reader.tabulate("x,y\n1,2\n3,4\n5,6\n7,8\n", 2);
        assertEquals(2, table.getRowCount());
    }

    @Test
    void headerless_table_gets_synthetic_names() {
        TabularRows table = reader.tabulate("400 1.5\n401 1.7\n402 1.9\n", 0);

        assertEquals(' ', table.getDelimiter());
        assertFalse(table.hasHeader());
        assertEquals(List.of("col_1", "col_2"), table.getHeader());
        assertEquals(3, table.getRowCount());
    }

    @Test
    void first_two_numeric_columns_are_suggested() {
        TabularRows table = reader.tabulate("label,x,y\na,1,2\nb,3,4\nc,5,6\n", 0);
        List<ColumnInfo> columns = reader.classifyColumns(table);
        List<String> warnings = new ArrayList<>();

        AxisSuggestion axes = reader.suggestAxes(columns, warnings);

        assertFalse(columns.get(0).isNumeric());
        assertEquals(3, columns.get(0).getNonNumericCount());
        assertEquals(1, axes.getXIndex());
        assertEquals(2, axes.getYIndex());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void extra_numeric_columns_are_ambiguous() {
        TabularRows table = reader.tabulate("wavelength (nm),flux,flux_err,quality\n400,1,0.1,0\n401,2,0.1,0\n402,3,0.2,1\n", 0);
        List<String> warnings = new ArrayList<>();

        AxisSuggestion axes = reader.suggestAxes(reader.classifyColumns(table), warnings);

        assertEquals(0, axes.getXIndex());
        assertEquals(1, axes.getYIndex());
        assertEquals(List.of("Multiple numeric columns detected; please confirm X/Y columns before ingest."), warnings);
    }

    @Test
    void ambiguity_warning_names_hinted_columns() {
        TabularRows table = reader.tabulate("index,time,flux\n0,10.5,100\n1,11.5,101\n2,12.5,99\n", 0);
        List<String> warnings = new ArrayList<>();

        AxisSuggestion axes = reader.suggestAxes(reader.classifyColumns(table), warnings);

        assertEquals(0, axes.getXIndex());
        assertEquals(1, axes.getYIndex());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).endsWith(" Column names suggest X='time' and Y='flux'."));
    }

    @Test
    void single_numeric_column_is_reported() {
        TabularRows table = reader.tabulate("name,value\na,1\nb,2\nc,3\n", 0);
        List<String> warnings = new ArrayList<>();

        AxisSuggestion axes = reader.suggestAxes(reader.classifyColumns(table), warnings);

        assertEquals(1, axes.getXIndex());
        assertNull(axes.getYIndex());
        assertTrue(warnings.get(0).startsWith("Only one fully-numeric column detected"));
    }

    @Test
    void extract_skips_rows_without_numbers() {
        TabularRows table = reader.tabulate("1,10\n2,n/a\n3,30\n", 0);
        XYColumns xy = reader.extractXY(table, 0, 1);

        assertArrayEquals(new double[]{1, 3}, xy.getX());
        assertArrayEquals(new double[]{10, 30}, xy.getY());
        assertEquals(1, xy.getSkipped());
    }

    @Test
    void units_from_header_labels() {
        assertEquals("nm", DelimitedTextReader.extractUnit("Wavelength (nm)"));
        assertEquals("erg/s/cm2/A", DelimitedTextReader.extractUnit("Flux [erg/s/cm2/A]"));
        assertNull(DelimitedTextReader.extractUnit("flux"));
        assertNull(DelimitedTextReader.extractUnit("flux ()"));
        assertNull(DelimitedTextReader.extractUnit(null));
    }
}
