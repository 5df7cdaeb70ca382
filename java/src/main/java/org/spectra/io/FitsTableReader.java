package org.spectra.io;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.TableHDU;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectra.core.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.*;

/**
 * Reader for FITS files carrying 1-D spectra or light curves in table HDUs
 * (binary or ASCII tables).
 */
public class FitsTableReader {
    private static final Logger log = LoggerFactory.getLogger(FitsTableReader.class);

    /**
     * Read every table HDU in {@code payload}.
     *
     * @param warnings receives one entry per column whose data could not be read
     * @throws StructuralFailureException if the payload cannot be opened as FITS
     */
    public List<FitsTable> read(byte[] payload, List<String> warnings) throws StructuralFailureException {
        List<FitsTable> tables = new ArrayList<>();
        try (Fits fits = new Fits(new ByteArrayInputStream(payload))) {
            BasicHDU<?>[] hdus = readHdus(fits);
            for (int i = 0; i < hdus.length; i++) {
                if (hdus[i] instanceof TableHDU) {
                    tables.add(readTable(i, (TableHDU<?>) hdus[i], warnings));
                }
            }
            log.debug("FITS payload has {} HDUs, {} table(s)", hdus.length, tables.size());
        } catch (FitsException | IOException e) {
            log.warn("Unreadable FITS payload: {}", e.getMessage());
            throw new StructuralFailureException("Failed to parse FITS: " + e.getMessage(), e);
        }
        return tables;
    }

    private static BasicHDU<?>[] readHdus(Fits fits) throws StructuralFailureException {
        BasicHDU<?>[] hdus;
        try {
            hdus = fits.read();
        } catch (FitsException e) {
            log.warn("Unreadable FITS payload: {}", e.getMessage());
            throw new StructuralFailureException("Failed to parse FITS: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("Malformed FITS structure: {}", e.toString());
            throw new StructuralFailureException("Failed to parse FITS: malformed structure (" + e + ")", e);
        }
        if (hdus == null || hdus.length == 0) {
            throw new StructuralFailureException("Failed to parse FITS: no HDUs could be read");
        }
        return hdus;
    }

    private FitsTable readTable(int index, TableHDU<?> hdu, List<String> warnings) {
        Header header = hdu.getHeader();
        int nCols = hdu.getNCols();
        int nRows = header.getIntValue("NAXIS2", 0);

        List<FitsTable.Column> columns = new ArrayList<>(nCols);
        for (int c = 0; c < nCols; c++) {
            String name = hdu.getColumnName(c);
            String key = String.valueOf(c + 1);
            Parsed<Object> data = readColumn(hdu, c, nRows);
            if (!data.isOk()) {
                warnings.add(data.getIssue().getMessage());
            }
            columns.add(new FitsTable.Column(
                name == null || name.isBlank() ? "col_" + (c + 1) : name.strip(),
                header.getStringValue("TUNIT" + key),
                header.getDoubleValue("TSCAL" + key, 1.0),
                header.getDoubleValue("TZERO" + key, 0.0),
                data.isOk() ? data.getValue() : null));
        }
        return new FitsTable(index, hduName(index, header), columns);
    }

    private static Parsed<Object> readColumn(TableHDU<?> hdu, int column, int nRows) {
        if (nRows == 0) {
            // no rows means no data segment for the library to hand back
            return Parsed.ok(new double[0]);
        }
        try {
            return Parsed.ok(hdu.getColumn(column));
        } catch (FitsException | RuntimeException e) {
            log.debug("FITS column {} unreadable", column, e);
            return Parsed.failed(new ParseIssue(
                String.format("Could not read FITS column %d: %s", column, e.getMessage())));
        }
    }

    private static String hduName(int index, Header header) {
        String name = header.getStringValue("EXTNAME");
        if (name != null && !name.isBlank()) return name.strip();
        return index == 0 ? "PRIMARY" : "";
    }

    /**
     * Pick the table to use: the requested HDU if it is a table; otherwise the
     * first one named like a science spectrum; otherwise the first table.
     */
    public FitsTable chooseTable(List<FitsTable> tables, Integer requestedHdu, List<String> warnings) {
        if (tables.isEmpty()) return null;

        FitsTable chosen = null;
        if (requestedHdu != null) {
            for (FitsTable t : tables) {
                if (t.getHduIndex() == requestedHdu) {
                    chosen = t;
                    break;
                }
            }
            if (chosen == null) {
                warnings.add("Requested hdu_index=" + requestedHdu + " not found; using best-effort choice.");
            }
        }

        if (chosen == null) {
            chosen = tables.get(0);
            for (FitsTable t : tables) {
                if (t.toCandidate().looksLikeSpectrum()) {
                    chosen = t;
                    break;
                }
            }
        }

        if (tables.size() > 1) {
            warnings.add("Multiple FITS table HDUs detected; please confirm which HDU contains the spectrum.");
        }
        log.debug("Chose FITS HDU {} ({})", chosen.getHduIndex(), chosen.getHduName());
        return chosen;
    }

    public AxisSuggestion suggestAxes(FitsTable table, List<String> warnings) {
        AxisSuggestion suggestion = AxisHintScorer.suggest(table.getColumns());
        if (!suggestion.isComplete()) {
            warnings.add("Could not confidently infer X/Y columns from FITS; please select manually.");
        }
        return suggestion;
    }

    /**
     * Flattened X/Y values of two columns; non-numeric cells become NaN and
     * are counted.
     */
    public XYColumns extractXY(FitsTable table, int xIndex, int yIndex) {
        checkColumn(table, xIndex);
        checkColumn(table, yIndex);
        FitsTable.FlatColumn x = table.flatten(xIndex);
        FitsTable.FlatColumn y = table.flatten(yIndex);
        return new XYColumns(x.getValues(), y.getValues(), x.getCoerced() + y.getCoerced());
    }

    private static void checkColumn(FitsTable table, int index) {
        if (index < 0 || index >= table.getColumnCount()) {
            throw new IllegalArgumentException(String.format(
                "Column index %d out of range for HDU %d (%d columns)",
                index, table.getHduIndex(), table.getColumnCount()));
        }
    }
}
