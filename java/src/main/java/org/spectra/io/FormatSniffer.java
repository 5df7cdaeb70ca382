package org.spectra.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectra.core.ParserKind;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

/**
 * Classifies a payload as FITS (optionally gzip-wrapped), JCAMP-DX or
 * delimited text.
 *
 * <p>Order of checks: gzip-wrapped FITS is inflated first; FITS magic or a
 * FITS extension wins next, since binary magic is unambiguous; JCAMP-DX needs
 * both {@code ##} and a {@code JCAMP}/{@code XYDATA} marker in the head, so a
 * CSV with a stray {@code ##} comment stays delimited text.
 */
public final class FormatSniffer {
    private static final Logger log = LoggerFactory.getLogger(FormatSniffer.class);

    public static final int HEAD_BYTES = 4096;

    private static final String[] FITS_EXTENSIONS = {
        ".fits", ".fit", ".fts", ".fits.gz", ".fit.gz", ".fts.gz"
    };

    private FormatSniffer() {
    }

    /**
     * Outcome of sniffing: the format, the payload to hand to its reader, and
     * a failure message if a gzip-FITS payload could not be inflated.
     */
    public static final class SniffResult {
        private final ParserKind kind;
        private final byte[] payload;
        private final boolean gzipped;
        private final String failure;

        SniffResult(ParserKind kind, byte[] payload, boolean gzipped, String failure) {
            this.kind = kind;
            this.payload = payload;
            this.gzipped = gzipped;
            this.failure = failure;
        }

        public ParserKind getKind() { return kind; }
        public byte[] getPayload() { return payload; }
        public boolean isGzipped() { return gzipped; }
        public String getFailure() { return failure; }
        public boolean isFailed() { return failure != null; }
    }

    public static SniffResult sniff(byte[] raw, String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);

        byte[] payload = raw;
        boolean gzipped = false;
        if (lower.endsWith(".gz") && looksLikeFitsFileName(lower) && hasGzipMagic(raw)) {
            try {
                payload = gunzip(raw);
                gzipped = true;
            } catch (IOException e) {
                log.warn("gzip inflate failed for {}: {}", fileName, e.getMessage());
                return new SniffResult(ParserKind.FITS, raw, true, "gzip error: " + e.getMessage());
            }
        }

        if (hasFitsMagic(payload) || looksLikeFitsFileName(lower)) {
            log.debug("Sniffed {} as FITS (gzipped={})", fileName, gzipped);
            return new SniffResult(ParserKind.FITS, payload, gzipped, null);
        }

        String head = new String(payload, 0, Math.min(HEAD_BYTES, payload.length), StandardCharsets.ISO_8859_1);
        String upperHead = head.toUpperCase(Locale.ROOT);
        if (head.contains("##") && (upperHead.contains("JCAMP") || upperHead.contains("XYDATA"))) {
            log.debug("Sniffed {} as JCAMP-DX", fileName);
            return new SniffResult(ParserKind.JCAMP_DX, payload, false, null);
        }

        log.debug("Sniffed {} as delimited text", fileName);
        return new SniffResult(ParserKind.DELIMITED_TEXT, payload, false, null);
    }

    public static boolean looksLikeFitsFileName(String nameLower) {
        for (String ext : FITS_EXTENSIONS) {
            if (nameLower.endsWith(ext)) return true;
        }
        return false;
    }

    static boolean hasGzipMagic(byte[] data) {
        return data.length >= 2 && (data[0] & 0xFF) == 0x1F && (data[1] & 0xFF) == 0x8B;
    }

    static boolean hasFitsMagic(byte[] data) {
        return startsWith(data, "SIMPLE  ") || startsWith(data, "XTENSION");
    }

    private static boolean startsWith(byte[] data, String ascii) {
        byte[] prefix = ascii.getBytes(StandardCharsets.US_ASCII);
        if (data.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) return false;
        }
        return true;
    }

    static byte[] gunzip(byte[] data) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream(data.length * 4);
            byte[] buffer = new byte[8192];

            int count;
            while ((count = in.read(buffer)) != -1) {
                outputStream.write(buffer, 0, count);
            }
            return outputStream.toByteArray();
        }
    }
}
