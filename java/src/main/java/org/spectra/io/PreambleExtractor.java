package org.spectra.io;

import org.spectra.core.Preamble;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Separates leading instrument-header or comment lines from the data body of
 * a text export and pulls {@code key: value} / {@code key = value} metadata
 * out of them.
 *
 * <p>Two layouts are recognized and may be combined:
 * <ul>
 *   <li>an Ocean Optics style marker line ({@value #SPECTRAL_DATA_MARKER},
 *       case-insensitive) with everything before it treated as preamble;</li>
 *   <li>a leading run of blank lines and lines starting with {@code #},
 *       {@code //}, {@code ;} or {@code !}.</li>
 * </ul>
 */
public final class PreambleExtractor {

    public static final String SPECTRAL_DATA_MARKER = ">>>>>BEGIN SPECTRAL DATA<<<<<";

    private static final String[] COMMENT_PREFIXES = {"#", "//", ";", "!"};

    private static final Pattern META_KV = Pattern.compile(
        "^\\s*(?<key>[^:=]{1,64})\\s*[:=]\\s*(?<value>.+?)\\s*$");

    private PreambleExtractor() {
    }

    /**
     * Lines before the body, and the body itself.
     */
    public static final class Split {
        private final List<String> preambleLines;
        private final String body;

        Split(List<String> preambleLines, String body) {
            this.preambleLines = preambleLines;
            this.body = body;
        }

        public List<String> getPreambleLines() { return preambleLines; }
        public String getBody() { return body; }
    }

    /**
     * Preamble lines (marker section, then comment run) capped at
     * {@link Preamble#MAX_LINES}, with metadata extracted from them.
     */
    public static Preamble extract(String text) {
        Split marker = splitAtDataMarker(text);
        Split comments = splitLeadingComments(marker.getBody());

        List<String> lines = new ArrayList<>(marker.getPreambleLines());
        lines.addAll(comments.getPreambleLines());
        if (lines.size() > Preamble.MAX_LINES) {
            lines = lines.subList(0, Preamble.MAX_LINES);
        }
        return new Preamble(lines, extractMetadata(lines));
    }

    /**
     * The data body with the marker section and any leading comment run removed.
     */
    public static String stripForTabulation(String text) {
        return splitLeadingComments(splitAtDataMarker(text).getBody()).getBody();
    }

    public static Split splitAtDataMarker(String text) {
        List<String> lines = text.lines().collect(Collectors.toList());
        for (int i = 0; i < lines.size(); i++) {
            if (isDataMarker(lines.get(i))) {
                String body = String.join("\n", lines.subList(i + 1, lines.size()));
                return new Split(new ArrayList<>(lines.subList(0, i)), stripLeadingNewlines(body));
            }
        }
        return new Split(new ArrayList<>(), text);
    }

    public static Split splitLeadingComments(String text) {
        List<String> lines = text.lines().collect(Collectors.toList());
        List<String> pre = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isBlankOrComment(line)) {
                pre.add(line);
                continue;
            }
            return new Split(pre, String.join("\n", lines.subList(i, lines.size())));
        }
        return new Split(pre, "");
    }

    /**
     * First value wins when a key repeats.
     */
    public static Map<String, String> extractMetadata(List<String> preambleLines) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String line : preambleLines) {
            String stripped = line.strip();
            if (stripped.isEmpty() || isDataMarker(stripped)) continue;

            Matcher m = META_KV.matcher(stripped);
            if (!m.matches()) continue;

            String key = m.group("key").strip();
            String value = m.group("value").strip();
            if (key.isEmpty() || value.isEmpty()) continue;
            out.putIfAbsent(key, value);
        }
        return out;
    }

    public static boolean isDataMarker(String line) {
        return line.strip().toUpperCase(Locale.ROOT).equals(SPECTRAL_DATA_MARKER);
    }

    static boolean isBlankOrComment(String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) return true;
        for (String prefix : COMMENT_PREFIXES) {
            if (stripped.startsWith(prefix)) return true;
        }
        return false;
    }

    private static String stripLeadingNewlines(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == '\n') i++;
        return s.substring(i);
    }
}
