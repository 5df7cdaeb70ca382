package org.spectra.tools;

import org.spectra.core.ColumnInfo;
import org.spectra.core.FitsTableCandidate;
import org.spectra.core.ParserKind;
import org.spectra.io.IngestConfig;
import org.spectra.io.IngestPreview;
import org.spectra.io.IngestRequest;
import org.spectra.io.SpectrumIngestor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Show what the engine detected in a file before committing to a parse.
 */
@Command(
    name = "preview",
    description = "Preview a spectral data file: format, columns, suggested X/Y and warnings"
)
public class PreviewCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input file (CSV/TXT, JCAMP-DX, FITS or FITS.gz)")
    private File inputFile;

    @Option(names = {"--rows"}, description = "Number of preview rows (default: spectra.previewRows or 50)")
    private Integer rows;

    @Option(names = {"--hdu"}, description = "FITS HDU index to preview")
    private Integer hduIndex;

    @Override
    public Integer call() throws Exception {
        IngestConfig config = IngestConfig.fromEnv();
        byte[] payload = SpectraMain.readInput(inputFile, config);
        if (payload == null) {
            return 1;
        }

        IngestPreview preview;
        try {
            IngestRequest request = new IngestRequest(inputFile.getName(), payload);
            request.setMaxRows(rows != null ? rows : config.getPreviewRows());
            request.setHduIndex(hduIndex);
            preview = new SpectrumIngestor().preview(request);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.println("=== File Information ===");
        System.out.println("File: " + inputFile.getAbsolutePath());
        System.out.println("Size: " + SpectraMain.formatBytes(preview.getFileSizeBytes()));
        System.out.println("Parser: " + preview.getParser());
        System.out.println("Encoding: " + preview.getEncoding());
        if (preview.getParser() == ParserKind.DELIMITED_TEXT) {
            System.out.println("Delimiter: " + describeDelimiter(preview.getDelimiter()));
        }
        System.out.println("Header: " + (preview.hasHeader() ? "yes" : "no"));

        if (preview.getParser() == ParserKind.FITS && !preview.getFitsCandidates().isEmpty()) {
            System.out.println();
            System.out.println("=== FITS Tables ===");
            for (FitsTableCandidate c : preview.getFitsCandidates()) {
                String marker = preview.getHduIndex() != null && preview.getHduIndex() == c.getHduIndex() ? "*" : " ";
                System.out.printf("%s HDU %d %s: %s%n", marker, c.getHduIndex(), c.getHduName(), c.getColumns());
            }
        }

        if (!preview.getColumns().isEmpty()) {
            System.out.println();
            System.out.println("=== Columns ===");
            for (ColumnInfo col : preview.getColumns()) {
                System.out.printf("  [%d] %s%s%n", col.getIndex(), col.getName(), col.isNumeric() ? " (numeric)" : "");
            }
            System.out.println("Suggested X: " + describeColumn(preview.getColumns(), preview.getSuggestedXIndex()));
            System.out.println("Suggested Y: " + describeColumn(preview.getColumns(), preview.getSuggestedYIndex()));
            if (preview.getXUnitHint() != null) System.out.println("X unit hint: " + preview.getXUnitHint());
            if (preview.getYUnitHint() != null) System.out.println("Y unit hint: " + preview.getYUnitHint());
        }

        if (!preview.getPreviewRows().isEmpty()) {
            System.out.println();
            System.out.printf("=== Preview (%d rows) ===%n", preview.getPreviewRows().size());
            for (List<String> row : preview.getPreviewRows()) {
                System.out.println("  " + String.join("\t", row));
            }
        }

        if (preview.getSourceMetadata() != null && !preview.getSourceMetadata().isEmpty()) {
            System.out.println();
            System.out.println("=== Source Metadata ===");
            for (Map.Entry<String, String> entry : preview.getSourceMetadata().entrySet()) {
                System.out.printf("  %s: %s%n", entry.getKey(), entry.getValue());
            }
        }

        if (!preview.getWarnings().isEmpty()) {
            System.out.println();
            System.out.println("=== Warnings ===");
            for (String w : preview.getWarnings()) {
                System.out.println("  - " + w);
            }
        }

        if (preview.isFailed()) {
            System.err.println("Error: " + preview.getStructuralFailure());
            return 1;
        }
        return 0;
    }

    private static String describeColumn(List<ColumnInfo> columns, Integer index) {
        if (index == null) return "(none)";
        for (ColumnInfo col : columns) {
            if (col.getIndex() == index) return "[" + index + "] " + col.getName();
        }
        return "[" + index + "]";
    }

    static String describeDelimiter(String delimiter) {
        switch (delimiter) {
            case "\t": return "TAB";
            case " ": return "SPACE";
            default: return delimiter;
        }
    }
}
