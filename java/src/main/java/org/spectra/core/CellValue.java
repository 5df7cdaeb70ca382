package org.spectra.core;

import java.util.regex.Pattern;

/**
 * A single table cell, classified once: numeric, text, or empty.
 */
public final class CellValue {

    public enum Kind { NUMERIC, TEXT, EMPTY }

    private static final Pattern DECIMAL = Pattern.compile(
        "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SPECIAL = Pattern.compile(
        "[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private static final CellValue EMPTY = new CellValue(Kind.EMPTY, Double.NaN, "");

    private final Kind kind;
    private final double number;
    private final String text;

    private CellValue(Kind kind, double number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    /**
     * Classify a raw cell. Accepts plain decimals, exponents and the
     * {@code inf}/{@code nan} spellings; rejects Java-only forms such as
     * hex literals or a trailing {@code d}/{@code f}.
     */
    public static CellValue of(String raw) {
        if (raw == null) return EMPTY;
        String s = raw.trim();
        if (s.isEmpty()) return EMPTY;
        Double parsed = parseNumber(s);
        if (parsed == null) return new CellValue(Kind.TEXT, Double.NaN, s);
        return new CellValue(Kind.NUMERIC, parsed, s);
    }

    /**
     * @return the numeric value of {@code s}, or null if it is not a number
     */
    public static Double parseNumber(String s) {
        String t = s.trim();
        if (DECIMAL.matcher(t).matches()) {
            return Double.parseDouble(t);
        }
        if (SPECIAL.matcher(t).matches()) {
            boolean negative = t.startsWith("-");
            String word = t.replaceFirst("^[+-]", "").toLowerCase();
            if (word.equals("nan")) return Double.NaN;
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return null;
    }

    public Kind getKind() { return kind; }
    public boolean isNumeric() { return kind == Kind.NUMERIC; }
    public boolean isEmpty() { return kind == Kind.EMPTY; }

    public double getNumber() {
        if (kind != Kind.NUMERIC) {
            throw new IllegalStateException("Not a numeric cell: " + text);
        }
        return number;
    }

    public String getText() { return text; }

    @Override
    public String toString() {
        return kind == Kind.EMPTY ? "Empty" : kind + "(" + text + ")";
    }
}
