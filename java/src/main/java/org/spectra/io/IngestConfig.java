package org.spectra.io;

/**
 * Settings resolved from a system property, then an environment variable,
 * then a default.
 */
public final class IngestConfig {
    public static final long DEFAULT_MAX_BYTES = 50L * 1024 * 1024;

    private final int previewRows;
    private final long maxBytes;

    public IngestConfig(int previewRows, long maxBytes) {
        if (previewRows <= 0) {
            throw new IllegalArgumentException("previewRows must be positive");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        this.previewRows = previewRows;
        this.maxBytes = maxBytes;
    }

    public static IngestConfig fromEnv() {
        int rows = Integer.parseInt(setting("spectra.previewRows", "SPECTRA_PREVIEW_ROWS",
            String.valueOf(IngestRequest.DEFAULT_PREVIEW_ROWS)));
        long max = Long.parseLong(setting("spectra.maxBytes", "SPECTRA_MAX_BYTES",
            String.valueOf(DEFAULT_MAX_BYTES)));
        return new IngestConfig(rows, max);
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback)).strip();
    }

    /** Rows returned by a preview. */
    public int getPreviewRows() { return previewRows; }

    /** Largest payload the caller should hand to the engine. */
    public long getMaxBytes() { return maxBytes; }
}
