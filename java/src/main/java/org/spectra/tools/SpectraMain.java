package org.spectra.tools;

import org.spectra.io.IngestConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Main entry point for the spectral ingestion command-line tools.
 */
@Command(
    name = "spectra",
    mixinStandardHelpOptions = true,
    version = "Spectra Ingest 1.0.0",
    description = "Preview and parse uploaded spectral data files (CSV/TXT, JCAMP-DX, FITS)",
    subcommands = {
        PreviewCommand.class,
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class SpectraMain implements Runnable {

    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.org.spectra";

    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SpectraMain()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When called without subcommand, show help
        CommandLine.usage(this, System.out);
    }

    // Engine loggers are created lazily by the subcommands, after this runs.
    @Option(names = {"-v", "--verbose"}, description = "Log parsing decisions at debug level")
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        if (verbose) {
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Read an input file, refusing anything over the configured size limit.
     * Prints the error and returns null on failure.
     */
    static byte[] readInput(File inputFile, IngestConfig config) {
        if (!inputFile.isFile()) {
            System.err.println("Error: File not found: " + inputFile);
            return null;
        }
        if (inputFile.length() > config.getMaxBytes()) {
            System.err.printf("Error: File is %s, larger than the %s limit%n",
                formatBytes(inputFile.length()), formatBytes(config.getMaxBytes()));
            return null;
        }
        try {
            return Files.readAllBytes(inputFile.toPath());
        } catch (IOException e) {
            System.err.println("Error reading file: " + e.getMessage());
            return null;
        }
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KB", bytes / 1024.0);
        if (bytes < 1024 * 1024 * 1024) return String.format("%.1f MB", bytes / (1024.0 * 1024));
        return String.format("%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }
}
