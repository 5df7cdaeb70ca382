package org.spectra.core;

/**
 * Parser that produced a preview or series.
 */
public enum ParserKind {
    FITS("fits"),
    JCAMP_DX("jcamp-dx"),
    DELIMITED_TEXT("delimited-text");

    private final String label;

    ParserKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
