package org.spectra.io;

/**
 * X/Y values pulled from two columns before canonicalization, with the
 * number of cells that could not be read as numbers.
 */
public class XYColumns {
    private final double[] x;
    private final double[] y;
    private final int skipped;

    public XYColumns(double[] x, double[] y, int skipped) {
        this.x = x;
        this.y = y;
        this.skipped = skipped;
    }

    public double[] getX() { return x; }
    public double[] getY() { return y; }

    /** Rows skipped (delimited text) or cells coerced to NaN (FITS). */
    public int getSkipped() { return skipped; }
}
