package org.spectra.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectra.core.*;

import java.util.*;

/**
 * Turns an uploaded spectral file into a preview or a canonical X/Y series.
 *
 * <p>Stateless: one instance can serve any number of concurrent calls. The
 * caller's payload is never modified. Bounding the payload size is the
 * caller's job.
 */
public class SpectrumIngestor {
    private static final Logger log = LoggerFactory.getLogger(SpectrumIngestor.class);

    static final String ENCODING_BINARY = "binary";

    private final DelimitedTextReader delimitedReader = new DelimitedTextReader();
    private final JcampDxReader jcampReader = new JcampDxReader();
    private final FitsTableReader fitsReader = new FitsTableReader();

    // ------------------------------------------------------------------ preview

    public IngestPreview preview(IngestRequest request) {
        FormatSniffer.SniffResult sniff = FormatSniffer.sniff(request.getPayload(), request.getFileName());

        IngestPreview preview = new IngestPreview();
        preview.setFileName(request.getFileName());
        preview.setFileSizeBytes(request.getPayload().length);
        preview.setParser(sniff.getKind());

        switch (sniff.getKind()) {
            case FITS:
                previewFits(sniff, request, preview);
                break;
            case JCAMP_DX:
                previewJcamp(sniff, request, preview);
                break;
            default:
                previewDelimited(sniff, request, preview);
                break;
        }

        log.debug("Preview of {}: {}", request.getFileName(), preview);
        return preview;
    }

    private void previewFits(FormatSniffer.SniffResult sniff, IngestRequest request, IngestPreview preview) {
        preview.setEncoding(ENCODING_BINARY);
        preview.setHasHeader(true);
        preview.setFitsCandidates(new ArrayList<>());

        if (sniff.isFailed()) {
            preview.addWarning("File looks like gzip-compressed FITS, but preview decompression failed.");
            preview.addWarning(sniff.getFailure());
            preview.setStructuralFailure(sniff.getFailure());
            return;
        }

        List<FitsTable> tables;
        try {
            tables = fitsReader.read(sniff.getPayload(), preview.getWarnings());
        } catch (StructuralFailureException e) {
            preview.addWarning(e.getMessage());
            preview.setStructuralFailure(e.getMessage());
            return;
        }
        if (tables.isEmpty()) {
            preview.addWarning("No FITS table HDUs found for 1D spectra.");
            return;
        }

        List<FitsTableCandidate> candidates = new ArrayList<>();
        for (FitsTable t : tables) candidates.add(t.toCandidate());
        preview.setFitsCandidates(candidates);

        FitsTable chosen = fitsReader.chooseTable(tables, request.getHduIndex(), preview.getWarnings());
        preview.setHduIndex(chosen.getHduIndex());
        preview.setColumns(chosen.getColumns());

        AxisSuggestion axes = fitsReader.suggestAxes(chosen, preview.getWarnings());
        preview.setSuggestedXIndex(axes.getXIndex());
        preview.setSuggestedYIndex(axes.getYIndex());

        if (axes.isComplete()) {
            preview.setXUnitHint(chosen.getUnit(axes.getXIndex()));
            preview.setYUnitHint(chosen.getUnit(axes.getYIndex()));
            XYColumns xy = fitsReader.extractXY(chosen, axes.getXIndex(), axes.getYIndex());
            preview.setPreviewRows(pairRows(xy.getX(), xy.getY(), request.getMaxRows()));
        }
    }

    private void previewJcamp(FormatSniffer.SniffResult sniff, IngestRequest request, IngestPreview preview) {
        DecodedText text = TextDecoder.decode(sniff.getPayload());
        JcampSpectrum spectrum = jcampReader.read(text.getText());

        preview.setEncoding(text.getEncoding());
        preview.setHasHeader(true);
        preview.setXUnitHint(spectrum.getXUnit());
        preview.setYUnitHint(spectrum.getYUnit());
        preview.setColumns(List.of(
            new ColumnInfo(0, "x", true, 0),
            new ColumnInfo(1, "y", true, 0)));
        preview.setPreviewRows(pairRows(spectrum.getX(), spectrum.getY(), request.getMaxRows()));
        preview.setSuggestedXIndex(0);
        preview.setSuggestedYIndex(1);
        preview.getWarnings().addAll(spectrum.getWarnings());
        preview.setSourceMetadata(spectrum.getHeader());
    }

    private void previewDelimited(FormatSniffer.SniffResult sniff, IngestRequest request, IngestPreview preview) {
        DecodedText text = TextDecoder.decode(sniff.getPayload());
        Preamble preamble = PreambleExtractor.extract(text.getText());
        TabularRows table = delimitedReader.tabulate(text.getText(), request.getMaxRows());

        preview.setEncoding(text.getEncoding());
        preview.setDelimiter(String.valueOf(table.getDelimiter()));
        preview.setHasHeader(table.hasHeader());

        if (table.getRowCount() == 0) {
            preview.addWarning("No data rows parsed (file may be empty or non-tabular).");
        }

        List<ColumnInfo> columns = delimitedReader.classifyColumns(table);
        preview.setColumns(columns);

        AxisSuggestion axes = delimitedReader.suggestAxes(columns, preview.getWarnings());
        preview.setSuggestedXIndex(axes.getXIndex());
        preview.setSuggestedYIndex(axes.getYIndex());

        int width = table.getWidth();
        List<List<String>> rows = new ArrayList<>(table.getRowCount());
        for (List<String> row : table.getRows()) {
            List<String> padded = new ArrayList<>(width);
            for (int i = 0; i < width; i++) padded.add(TabularRows.cellAt(row, i));
            rows.add(padded);
        }
        preview.setPreviewRows(rows);

        if (axes.getXIndex() != null && axes.getXIndex() < table.getHeader().size()) {
            preview.setXUnitHint(DelimitedTextReader.extractUnit(table.getHeader().get(axes.getXIndex())));
        }
        if (axes.getYIndex() != null && axes.getYIndex() < table.getHeader().size()) {
            preview.setYUnitHint(DelimitedTextReader.extractUnit(table.getHeader().get(axes.getYIndex())));
        }

        if (!preamble.getLines().isEmpty()) preview.setSourcePreamble(preamble.getLines());
        if (!preamble.getMetadata().isEmpty()) preview.setSourceMetadata(preamble.getMetadata());
    }

    // ------------------------------------------------------------------- commit

    /**
     * Parse the whole file into a canonical series, using the caller's column
     * selections where given and the heuristics otherwise.
     *
     * @throws StructuralFailureException if a FITS or gzip-FITS payload cannot be opened
     */
    public ParsedSeries commit(IngestRequest request) throws StructuralFailureException {
        FormatSniffer.SniffResult sniff = FormatSniffer.sniff(request.getPayload(), request.getFileName());

        ParsedSeries series = new ParsedSeries();
        series.setSourceFileName(request.getFileName());
        series.setParser(sniff.getKind());

        XYColumns xy;
        switch (sniff.getKind()) {
            case FITS:
                xy = commitFits(sniff, request, series);
                break;
            case JCAMP_DX:
                xy = commitJcamp(sniff, request, series);
                break;
            default:
                xy = commitDelimited(sniff, request, series);
                break;
        }

        Canonicalizer.Result canonical = Canonicalizer.canonicalize(xy.getX(), xy.getY());
        series.setData(canonical.getX(), canonical.getY());
        series.addWarnings(canonical.getWarnings());
        series.putDecision("canonicalization", canonical.getAction().getLabel());
        series.putDecision("dropped_nonfinite", canonical.getDroppedNonFinite());

        if (series.isEmpty() && canonical.getDroppedNonFinite() > 0) {
            series.addWarning("All X/Y pairs were dropped as non-finite; the series is empty.");
        }
        if (series.getXUnit() == null) {
            series.addWarning("X unit is missing; please confirm units for trustworthy comparisons.");
        }
        if (series.getYUnit() == null) {
            series.addWarning("Y unit is missing; please confirm units for trustworthy comparisons.");
        }

        log.info("Ingested {} as {}: {} points, canonicalization={}, {} warning(s)",
            request.getFileName(), sniff.getKind(), series.size(), canonical.getAction(), series.getWarnings().size());
        return series;
    }

    private XYColumns commitFits(FormatSniffer.SniffResult sniff, IngestRequest request, ParsedSeries series)
            throws StructuralFailureException {
        if (sniff.isFailed()) {
            throw new StructuralFailureException("File looks like gzip-compressed FITS, but decompression failed: "
                + sniff.getFailure());
        }
        series.putDecision("encoding", ENCODING_BINARY);

        List<FitsTable> tables = fitsReader.read(sniff.getPayload(), series.getWarnings());
        if (tables.isEmpty()) {
            series.addWarning("No FITS table HDUs found for 1D spectra.");
            return empty();
        }

        FitsTable table = fitsReader.chooseTable(tables, request.getHduIndex(), series.getWarnings());
        series.putDecision("hdu_index", table.getHduIndex());
        series.putDecision("hdu_name", table.getHduName());

        Integer xIndex = request.getXIndex();
        Integer yIndex = request.getYIndex();
        if (xIndex == null || yIndex == null) {
            AxisSuggestion axes = fitsReader.suggestAxes(table, series.getWarnings());
            if (xIndex == null) xIndex = axes.getXIndex();
            if (yIndex == null) yIndex = axes.getYIndex();
        }
        if (xIndex == null || yIndex == null) {
            series.addWarning("No numeric X/Y pairs parsed with the selected column mapping.");
            return empty();
        }

        series.putDecision("x_index", xIndex);
        series.putDecision("y_index", yIndex);
        XYColumns xy = fitsReader.extractXY(table, xIndex, yIndex);
        if (xy.getX().length == 0 || xy.getY().length == 0) {
            series.addWarning("Selected FITS table HDU " + table.getHduIndex() + " has no rows.");
        }
        series.putDecision("x_col", table.getColumnNames().get(xIndex));
        series.putDecision("y_col", table.getColumnNames().get(yIndex));
        series.putDecision("coerced_nonnumeric", xy.getSkipped());
        if (xy.getSkipped() > 0) {
            series.addWarning(String.format(
                "Coerced %d non-numeric FITS cell(s) to NaN; affected pairs are dropped.", xy.getSkipped()));
        }

        series.setXUnit(unitOr(request.getXUnit(), table.getUnit(xIndex)));
        series.setYUnit(unitOr(request.getYUnit(), table.getUnit(yIndex)));
        return xy;
    }

    private XYColumns commitJcamp(FormatSniffer.SniffResult sniff, IngestRequest request, ParsedSeries series) {
        DecodedText text = TextDecoder.decode(sniff.getPayload());
        JcampSpectrum spectrum = jcampReader.read(text.getText());

        series.putDecision("encoding", text.getEncoding());
        series.putDecision("jcamp_mode", spectrum.getMode());
        if (spectrum.getTitle() != null) series.putDecision("title", spectrum.getTitle());
        series.addWarnings(spectrum.getWarnings());
        series.setMetadata(spectrum.getHeader());
        series.setXUnit(unitOr(request.getXUnit(), spectrum.getXUnit()));
        series.setYUnit(unitOr(request.getYUnit(), spectrum.getYUnit()));
        return new XYColumns(spectrum.getX(), spectrum.getY(), 0);
    }

    private XYColumns commitDelimited(FormatSniffer.SniffResult sniff, IngestRequest request, ParsedSeries series) {
        DecodedText text = TextDecoder.decode(sniff.getPayload());
        Preamble preamble = PreambleExtractor.extract(text.getText());
        TabularRows table = delimitedReader.tabulate(text.getText(), 0);

        series.putDecision("encoding", text.getEncoding());
        series.putDecision("delimiter", String.valueOf(table.getDelimiter()));
        series.putDecision("has_header", table.hasHeader());
        series.setPreamble(preamble.getLines());
        series.setMetadata(preamble.getMetadata());

        Integer xIndex = request.getXIndex();
        Integer yIndex = request.getYIndex();
        if (xIndex == null || yIndex == null) {
            AxisSuggestion axes = delimitedReader.suggestAxes(delimitedReader.classifyColumns(table), series.getWarnings());
            if (xIndex == null) xIndex = axes.getXIndex();
            if (yIndex == null) yIndex = axes.getYIndex();
        }
        if (xIndex == null || yIndex == null) {
            series.addWarning("No numeric X/Y pairs parsed with the selected column mapping.");
            return empty();
        }

        series.putDecision("x_index", xIndex);
        series.putDecision("y_index", yIndex);
        int width = table.getWidth();
        for (int index : new int[]{xIndex, yIndex}) {
            if (index >= width) {
                series.addWarning(String.format("Column index %d is out of range (%d columns).", index, width));
            }
        }

        XYColumns xy = delimitedReader.extractXY(table, xIndex, yIndex);
        if (xy.getX().length == 0) {
            series.addWarning("No numeric X/Y pairs parsed with the selected column mapping.");
        } else if (xy.getSkipped() > 0) {
            series.addWarning(String.format(
                "Skipped %d row(s) without numeric values in the selected columns.", xy.getSkipped()));
        }

        series.setXUnit(unitOr(request.getXUnit(), headerUnit(table, xIndex)));
        series.setYUnit(unitOr(request.getYUnit(), headerUnit(table, yIndex)));
        return xy;
    }

    // ------------------------------------------------------------------ helpers

    private static String headerUnit(TabularRows table, int index) {
        if (!table.hasHeader() || index >= table.getHeader().size()) return null;
        return DelimitedTextReader.extractUnit(table.getHeader().get(index));
    }

    /** The caller's unit if given, else the detected one; blanks count as missing. */
    static String unitOr(String explicit, String detected) {
        if (explicit != null && !explicit.isBlank()) return explicit.strip();
        if (detected != null && !detected.isBlank()) return detected.strip();
        return null;
    }

    private static List<List<String>> pairRows(double[] x, double[] y, int maxRows) {
        int n = Math.min(maxRows, Math.min(x.length, y.length));
        List<List<String>> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            rows.add(List.of(Double.toString(x[i]), Double.toString(y[i])));
        }
        return rows;
    }

    private static XYColumns empty() {
        return new XYColumns(new double[0], new double[0], 0);
    }
}
