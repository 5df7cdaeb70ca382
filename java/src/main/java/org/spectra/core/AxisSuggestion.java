package org.spectra.core;

/**
 * Suggested X/Y column indices; either may be absent.
 */
public class AxisSuggestion {
    private final Integer xIndex;
    private final Integer yIndex;

    public AxisSuggestion(Integer xIndex, Integer yIndex) {
        this.xIndex = xIndex;
        this.yIndex = yIndex;
    }

    public static AxisSuggestion none() {
        return new AxisSuggestion(null, null);
    }

    public Integer getXIndex() { return xIndex; }
    public Integer getYIndex() { return yIndex; }

    public boolean isComplete() {
        return xIndex != null && yIndex != null;
    }

    @Override
    public String toString() {
        return "AxisSuggestion(x=" + xIndex + ", y=" + yIndex + ")";
    }
}
