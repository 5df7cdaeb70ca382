package org.spectra.tools;

import org.spectra.core.ParsedSeries;
import org.spectra.core.StructuralFailureException;
import org.spectra.io.IngestConfig;
import org.spectra.io.IngestRequest;
import org.spectra.io.SpectrumIngestor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.*;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Parse a file into a canonical X/Y series and optionally export it.
 */
@Command(
    name = "parse",
    description = "Parse a spectral data file into a canonical X/Y series"
)
public class ParseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input file")
    private File inputFile;

    @Parameters(index = "1", arity = "0..1", description = "Output file (.csv, .tsv or .txt)")
    private File outputFile;

    @Option(names = {"--x"}, description = "Zero-based X column index")
    private Integer xIndex;

    @Option(names = {"--y"}, description = "Zero-based Y column index")
    private Integer yIndex;

    @Option(names = {"--hdu"}, description = "FITS HDU index")
    private Integer hduIndex;

    @Option(names = {"--x-unit"}, description = "X unit, overrides any unit found in the file")
    private String xUnit;

    @Option(names = {"--y-unit"}, description = "Y unit, overrides any unit found in the file")
    private String yUnit;

    @Override
    public Integer call() throws Exception {
        byte[] payload = SpectraMain.readInput(inputFile, IngestConfig.fromEnv());
        if (payload == null) {
            return 1;
        }

        ParsedSeries series;
        try {
            IngestRequest request = new IngestRequest(inputFile.getName(), payload);
            request.setXIndex(xIndex);
            request.setYIndex(yIndex);
            request.setHduIndex(hduIndex);
            request.setXUnit(xUnit);
            request.setYUnit(yUnit);
            series = new SpectrumIngestor().commit(request);
        } catch (StructuralFailureException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.println("Parsed: " + inputFile);
        System.out.printf("Parser: %s, %d points%n", series.getParser(), series.size());
        if (!series.isEmpty()) {
            System.out.printf("X: %s - %s %s%n", series.getXMin(), series.getXMax(), orBlank(series.getXUnit()));
            System.out.printf("Y: %s - %s %s%n", series.getYMin(), series.getYMax(), orBlank(series.getYUnit()));
        }
        for (Map.Entry<String, Object> entry : series.getDecisions().entrySet()) {
            System.out.printf("  %s = %s%n", entry.getKey(), entry.getValue());
        }
        for (String w : series.getWarnings()) {
            System.out.println("Warning: " + w);
        }

        if (outputFile == null) {
            return 0;
        }

        String outputName = outputFile.getName().toLowerCase();
        System.out.println("Writing: " + outputFile);
        try {
            if (outputName.endsWith(".tsv") || outputName.endsWith(".txt")) {
                write(series, outputFile, "\t");
            } else if (outputName.endsWith(".csv")) {
                write(series, outputFile, ",");
            } else {
                System.err.println("Error: Unsupported output format. Use .tsv, .txt, or .csv");
                return 1;
            }
        } catch (IOException e) {
            System.err.println("Error writing file: " + e.getMessage());
            return 1;
        }

        System.out.println("Done!");
        return 0;
    }

    private void write(ParsedSeries series, File output, String separator) throws IOException {
        try (PrintWriter writer = new PrintWriter(new FileWriter(output))) {
            writer.println("# Spectra Export");
            writer.println("# Source: " + series.getSourceFileName());
            writer.println("# Parser: " + series.getParser());
            writer.println("# X unit: " + orBlank(series.getXUnit()));
            writer.println("# Y unit: " + orBlank(series.getYUnit()));
            writer.println("# Canonicalization: " + series.getDecisions().get("canonicalization"));
            for (String w : series.getWarnings()) {
                writer.println("# Warning: " + w);
            }
            writer.println("x" + separator + "y");
            for (int i = 0; i < series.size(); i++) {
                writer.println(series.getXAt(i) + separator + series.getYAt(i));
            }
        }
    }

    private static String orBlank(String s) {
        return s == null ? "" : s;
    }
}
