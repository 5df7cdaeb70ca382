package org.spectra.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectra.core.CellValue;
import org.spectra.core.ParseIssue;
import org.spectra.core.Parsed;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reader for JCAMP-DX text in uncompressed (AFFN) form.
 *
 * <p>Supported data blocks:
 * <ul>
 *   <li>{@code ##XYDATA=(X++(Y..Y))}: each line starts with an X value
 *       followed by Y values spaced {@code DELTAX * XFACTOR} apart;</li>
 *   <li>{@code ##XYDATA=(XY..XY)} and {@code ##PEAK TABLE=(XY..XY)}:
 *       alternating X,Y values.</li>
 * </ul>
 * Values are scaled by {@code XFACTOR}/{@code YFACTOR}. Nothing is invented:
 * without {@code DELTAX} an X++ block keeps only the first point of each
 * line and says so.
 */
public class JcampDxReader {
    private static final Logger log = LoggerFactory.getLogger(JcampDxReader.class);

    public static final String MODE_XPP = "x++(y..y)";
    public static final String MODE_XPP_DEGRADED = "x++(y..y)-degraded";
    public static final String MODE_XY_PAIRS = "(xy..xy)";
    public static final String MODE_PEAK_TABLE = "peak-table";

    private static final Pattern TAG = Pattern.compile("^##(?<key>[^=]+)=(?<value>.*)$");

    public JcampSpectrum read(String text) {
        String[] lines = text.replace("\r\n", "\n").replace("\r", "\n").split("\n", -1);
        List<String> warnings = new ArrayList<>();

        Map<String, String> header = new LinkedHashMap<>();
        int dataStart = parseHeader(lines, header, warnings);

        DataBlock block = parseData(lines, dataStart, header, warnings);
        double[] x = block.x;
        double[] y = block.y;

        if (x.length == 0 || y.length == 0) {
            warnings.add("No plottable X/Y points were parsed from JCAMP-DX.");
        }
        if (x.length != y.length) {
            warnings.add("Parsed X and Y lengths differ; truncating to shortest length.");
            int n = Math.min(x.length, y.length);
            x = Arrays.copyOf(x, n);
            y = Arrays.copyOf(y, n);
        }

        Double declared = number(header.get("NPOINTS"));
        if (declared != null && block.mode != null && !MODE_XPP_DEGRADED.equals(block.mode)
                && x.length > 0 && declared.intValue() != x.length) {
            warnings.add(String.format("NPOINTS declares %d points but %d were parsed.", declared.intValue(), x.length));
        }

        log.debug("JCAMP-DX: {} header tags, mode={}, {} points", header.size(), block.mode, x.length);
        return new JcampSpectrum(header, block.mode, x, y, warnings);
    }

    /**
     * Collect {@code ##KEY=value} tags (key upper-cased) up to the first data
     * block tag.
     *
     * @return index of the data block tag line, or the line count if none
     */
    int parseHeader(String[] lines, Map<String, String> header, List<String> warnings) {
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (!line.startsWith("##")) continue;
            if (isDataTag(line)) return i;

            parseTag(line).ifOkOrWarn(tag -> header.put(tag[0], tag[1]), warnings);
        }
        return lines.length;
    }

    static Parsed<String[]> parseTag(String line) {
        Matcher m = TAG.matcher(line);
        if (!m.matches()) {
            return Parsed.failed(new ParseIssue("Ignored malformed JCAMP-DX header line: " + line));
        }
        String key = m.group("key").strip().toUpperCase(Locale.ROOT);
        return Parsed.ok(new String[]{key, m.group("value").strip()});
    }

    private static final class DataBlock {
        final String mode;
        final double[] x;
        final double[] y;

        DataBlock(String mode, double[] x, double[] y) {
            this.mode = mode;
            this.x = x;
            this.y = y;
        }
    }

    private DataBlock parseData(String[] lines, int start, Map<String, String> header, List<String> warnings) {
        String tag = null;
        for (int i = start; i < lines.length; i++) {
            String line = lines[i].strip();
            if (isDataTag(line)) {
                tag = line.toUpperCase(Locale.ROOT);
                start = i + 1;
                break;
            }
        }
        if (tag == null) {
            warnings.add("No ##XYDATA block found in JCAMP-DX.");
            return new DataBlock(null, new double[0], new double[0]);
        }

        double xFactor = factor(header.get("XFACTOR"));
        double yFactor = factor(header.get("YFACTOR"));
        Double deltaX = number(header.get("DELTAX"));

        boolean xpp = tag.contains("X++");
        boolean peakTable = tag.startsWith("##PEAK TABLE");
        int group = 2;
        String mode;
        if (xpp) {
            mode = deltaX == null ? MODE_XPP_DEGRADED : MODE_XPP;
            if (deltaX == null) {
                warnings.add("JCAMP-DX uses X++ mode but DELTAX is missing; cannot expand X grid reliably. "
                    + "Kept only the first point of each line.");
            }
        } else {
            mode = peakTable ? MODE_PEAK_TABLE : MODE_XY_PAIRS;
            if (tag.contains("XYW") || tag.contains("XYM")) {
                group = 3;
                warnings.add("JCAMP-DX peak table carries a third value per peak; only X and Y were kept.");
            }
        }

        List<Double> x = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        int oddLines = 0;
        int ignoredTokens = 0;

        for (int i = start; i < lines.length; i++) {
            String s = stripComment(lines[i]).strip();
            if (s.isEmpty()) continue;
            if (s.startsWith("##")) break;

            List<Double> nums = new ArrayList<>();
            for (Parsed<Double> token : tokenize(s)) {
                if (token.isOk()) {
                    nums.add(token.getValue());
                } else {
                    ignoredTokens++;
                }
            }
            if (nums.isEmpty()) continue;

            if (xpp) {
                double x0 = nums.get(0) * xFactor;
                if (deltaX == null) {
                    // degraded: no grid to expand onto
                    if (nums.size() > 1) {
                        x.add(x0);
                        y.add(nums.get(1) * yFactor);
                    }
                    continue;
                }
                double step = deltaX * xFactor;
                for (int k = 1; k < nums.size(); k++) {
                    x.add(x0 + (k - 1) * step);
                    y.add(nums.get(k) * yFactor);
                }
            } else {
                if (nums.size() % group != 0) oddLines++;
                for (int k = 0; k + 1 < nums.size(); k += group) {
                    x.add(nums.get(k) * xFactor);
                    y.add(nums.get(k + 1) * yFactor);
                }
            }
        }

        if (oddLines > 0) {
            warnings.add(String.format(
                "Odd number of numeric tokens in %d XYDATA line(s); trailing value ignored.", oddLines));
        }
        if (ignoredTokens > 0) {
            warnings.add(String.format(
                "Ignored %d non-numeric token(s) in the data block (compressed JCAMP-DX forms are not decoded).",
                ignoredTokens));
        }

        return new DataBlock(mode, toArray(x), toArray(y));
    }

    static List<Parsed<Double>> tokenize(String line) {
        List<Parsed<Double>> out = new ArrayList<>();
        for (String part : line.replace(',', ' ').strip().split("\\s+")) {
            if (part.isEmpty()) continue;
            Double v = CellValue.parseNumber(part);
            out.add(v != null
                ? Parsed.ok(v)
                : Parsed.failed(new ParseIssue("Non-numeric token: " + part)));
        }
        return out;
    }

    private static boolean isDataTag(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        return upper.startsWith("##XYDATA") || upper.startsWith("##PEAK TABLE");
    }

    private static String stripComment(String line) {
        int idx = line.indexOf("$$");
        return idx >= 0 ? line.substring(0, idx) : line;
    }

    /** Missing, unparsable or zero factors mean 1. */
    private static double factor(String value) {
        Double v = number(value);
        return v == null || v == 0.0 ? 1.0 : v;
    }

    private static Double number(String value) {
        return value == null ? null : CellValue.parseNumber(value);
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
