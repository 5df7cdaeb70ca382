package org.spectra.core;

import java.util.*;

/**
 * Canonical X/Y series produced by an ingestion, with units and diagnostics.
 */
public class ParsedSeries {
    private double[] x;
    private double[] y;
    private String sourceFileName;
    private ParserKind parser;
    private String xUnit;
    private String yUnit;
    private Map<String, Object> decisions;
    private List<String> warnings;
    private List<String> preamble;
    private Map<String, String> metadata;

    // Cached statistics
    private double xMin;
    private double xMax;
    private double yMin;
    private double yMax;

    public ParsedSeries() {
        this.x = new double[0];
        this.y = new double[0];
        this.decisions = new LinkedHashMap<>();
        this.warnings = new ArrayList<>();
        this.preamble = new ArrayList<>();
        this.metadata = new LinkedHashMap<>();
    }

    public ParsedSeries(double[] x, double[] y) {
        this();
        setData(x, y);
    }

    public void setData(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("X and Y arrays must have same length");
        }
        this.x = x.clone();
        this.y = y.clone();
        updateStatistics();
    }

    private void updateStatistics() {
        if (x.length == 0) {
            xMin = 0;
            xMax = 0;
            yMin = 0;
            yMax = 0;
            return;
        }

        xMin = Double.POSITIVE_INFINITY;
        xMax = Double.NEGATIVE_INFINITY;
        yMin = Double.POSITIVE_INFINITY;
        yMax = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < x.length; i++) {
            if (x[i] < xMin) xMin = x[i];
            if (x[i] > xMax) xMax = x[i];
            if (y[i] < yMin) yMin = y[i];
            if (y[i] > yMax) yMax = y[i];
        }
    }

    // Getters and setters
    public int size() { return x.length; }
    public boolean isEmpty() { return x.length == 0; }

    public double[] getX() { return x; }
    public double[] getY() { return y; }

    public double getXAt(int i) { return x[i]; }
    public double getYAt(int i) { return y[i]; }

    public String getSourceFileName() { return sourceFileName; }
    public void setSourceFileName(String sourceFileName) { this.sourceFileName = sourceFileName; }

    public ParserKind getParser() { return parser; }
    public void setParser(ParserKind parser) { this.parser = parser; }

    public String getXUnit() { return xUnit; }
    public void setXUnit(String xUnit) { this.xUnit = xUnit; }

    public String getYUnit() { return yUnit; }
    public void setYUnit(String yUnit) { this.yUnit = yUnit; }

    public Map<String, Object> getDecisions() { return decisions; }
    public void putDecision(String key, Object value) { decisions.put(key, value); }

    public List<String> getWarnings() { return warnings; }
    public void addWarning(String warning) { warnings.add(warning); }
    public void addWarnings(Collection<String> more) { warnings.addAll(more); }

    public List<String> getPreamble() { return preamble; }
    public void setPreamble(List<String> preamble) { this.preamble = new ArrayList<>(preamble); }

    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = new LinkedHashMap<>(metadata); }

    public double getXMin() { return xMin; }
    public double getXMax() { return xMax; }
    public double getYMin() { return yMin; }
    public double getYMax() { return yMax; }

    /**
     * Check if the series is sorted by X.
     */
    public boolean isSorted() {
        for (int i = 1; i < x.length; i++) {
            if (x[i] < x[i-1]) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("ParsedSeries(size=%d, parser=%s, x=[%.4g, %.4g], warnings=%d)",
            size(), parser, xMin, xMax, warnings.size());
    }
}
