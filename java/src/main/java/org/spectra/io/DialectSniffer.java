package org.spectra.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectra.core.CellValue;

import java.util.*;

/**
 * Guesses the delimiter and header presence of delimited text from a sample.
 */
public final class DialectSniffer {
    private static final Logger log = LoggerFactory.getLogger(DialectSniffer.class);

    public static final int SAMPLE_CHARS = 64 * 1024;

    /** Candidates for sniffing, in order of preference when several qualify. */
    static final char[] CANDIDATES = {',', '\t', ';', '|', ' '};

    /** Candidates for the most-frequent fallback. */
    static final char[] FALLBACK_CANDIDATES = {',', '\t', ';', '|'};

    private static final int CHUNK_LINES = 10;
    private static final int HEADER_CHECK_ROWS = 20;

    private DialectSniffer() {
    }

    public static final class Dialect {
        private final char delimiter;
        private final boolean hasHeader;
        private final boolean sniffed;

        Dialect(char delimiter, boolean hasHeader, boolean sniffed) {
            this.delimiter = delimiter;
            this.hasHeader = hasHeader;
            this.sniffed = sniffed;
        }

        public char getDelimiter() { return delimiter; }
        public boolean hasHeader() { return hasHeader; }

        /** False when the delimiter came from the frequency fallback. */
        public boolean isSniffed() { return sniffed; }
    }

    public static Dialect sniff(String text) {
        String sample = text.length() > SAMPLE_CHARS ? text.substring(0, SAMPLE_CHARS) : text;
        List<String> lines = new ArrayList<>();
        for (String line : sample.split("\n")) {
            if (!line.isEmpty()) lines.add(line);
        }

        Character guessed = guessDelimiter(lines);
        if (guessed == null) {
            char fallback = mostFrequent(sample);
            log.debug("Delimiter sniffing failed; falling back to '{}'", printable(fallback));
            return new Dialect(fallback, false, false);
        }

        boolean header = hasHeader(lines, guessed);
        log.debug("Sniffed delimiter '{}', header={}", printable(guessed), header);
        return new Dialect(guessed, header, true);
    }

    /**
     * Delimiter whose per-line count is most consistent across the sample,
     * evaluated chunk by chunk; null if none qualifies.
     */
    static Character guessDelimiter(List<String> lines) {
        if (lines.isEmpty()) return null;

        int chunkLength = Math.min(CHUNK_LINES, lines.size());
        Map<Character, Map<Integer, Integer>> frequencies = new LinkedHashMap<>();
        for (char c : CANDIDATES) {
            frequencies.put(c, new LinkedHashMap<>());
        }

        Map<Character, int[]> delims = new LinkedHashMap<>();
        int iteration = 0;
        int start = 0;
        int end = chunkLength;
        while (start < lines.size()) {
            iteration++;
            for (String line : lines.subList(start, Math.min(end, lines.size()))) {
                for (char c : CANDIDATES) {
                    frequencies.get(c).merge(countOutsideQuotes(line, c), 1, Integer::sum);
                }
            }

            Map<Character, int[]> modes = new LinkedHashMap<>();
            for (Map.Entry<Character, Map<Integer, Integer>> entry : frequencies.entrySet()) {
                int[] mode = mode(entry.getValue());
                if (mode != null) modes.put(entry.getKey(), mode);
            }

            double total = Math.min((double) chunkLength * iteration, lines.size());
            double consistency = 1.0;
            while (delims.isEmpty() && consistency >= 0.9) {
                for (Map.Entry<Character, int[]> entry : modes.entrySet()) {
                    int[] v = entry.getValue();
                    if (v[0] > 0 && v[1] > 0 && v[1] / total >= consistency) {
                        delims.put(entry.getKey(), v);
                    }
                }
                consistency -= 0.01;
            }
            if (delims.size() == 1) {
                return delims.keySet().iterator().next();
            }

            start = end;
            end += chunkLength;
        }

        if (delims.isEmpty()) return null;
        for (char c : CANDIDATES) {
            if (delims.containsKey(c)) return c;
        }
        return null;
    }

    /**
     * {count, adjusted frequency} of the most common per-line count, where
     * the frequency is reduced by the lines that disagree; null if the
     * character never occurs.
     */
    private static int[] mode(Map<Integer, Integer> freq) {
        if (freq.size() == 1 && freq.containsKey(0)) return null;

        Map.Entry<Integer, Integer> best = null;
        int total = 0;
        for (Map.Entry<Integer, Integer> e : freq.entrySet()) {
            total += e.getValue();
            if (best == null || e.getValue() > best.getValue()) best = e;
        }
        int others = total - best.getValue();
        return new int[]{best.getKey(), best.getValue() - others};
    }

    /**
     * Vote over the first rows: a column whose body cells share a type
     * (numeric, or a fixed length) votes for a header when the first row
     * breaks that type.
     */
    static boolean hasHeader(List<String> lines, char delimiter) {
        if (lines.isEmpty()) return false;

        List<String> header = RowTokenizer.split(lines.get(0), delimiter);
        int columns = header.size();

        // Integer.MIN_VALUE marks numeric; a non-negative value is a string length
        Map<Integer, Integer> columnTypes = new LinkedHashMap<>();
        Set<Integer> undecided = new LinkedHashSet<>();
        for (int i = 0; i < columns; i++) undecided.add(i);

        int checked = 0;
        for (String line : lines.subList(1, lines.size())) {
            if (checked > HEADER_CHECK_ROWS) break;
            checked++;

            List<String> row = RowTokenizer.split(line, delimiter);
            if (row.size() != columns) continue;

            for (Integer col : new ArrayList<>(undecided)) {
                String cell = row.get(col);
                int thisType = CellValue.parseNumber(cell) != null ? Integer.MIN_VALUE : cell.length();
                Integer known = columnTypes.get(col);
                if (known == null) {
                    columnTypes.put(col, thisType);
                } else if (known != thisType) {
                    columnTypes.remove(col);
                    undecided.remove(col);
                }
            }
        }

        int votes = 0;
        for (Map.Entry<Integer, Integer> entry : columnTypes.entrySet()) {
            String cell = header.get(entry.getKey());
            int type = entry.getValue();
            if (type == Integer.MIN_VALUE) {
                votes += CellValue.parseNumber(cell) == null ? 1 : -1;
            } else {
                votes += cell.length() != type ? 1 : -1;
            }
        }
        return votes > 0;
    }

    static char mostFrequent(String sample) {
        char best = ',';
        int bestCount = 0;
        for (char c : FALLBACK_CANDIDATES) {
            int count = 0;
            for (int i = 0; i < sample.length(); i++) {
                if (sample.charAt(i) == c) count++;
            }
            if (count > bestCount) {
                best = c;
                bestCount = count;
            }
        }
        return best;
    }

    private static int countOutsideQuotes(String line, char c) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                quoted = !quoted;
            } else if (ch == c && !quoted) {
                count++;
            }
        }
        return count;
    }

    static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
