package org.spectra.core;

import java.util.Collections;
import java.util.List;

/**
 * A FITS HDU that carries a table, with its column names in order.
 */
public class FitsTableCandidate {
    private final int hduIndex;
    private final String hduName;
    private final List<String> columns;

    public FitsTableCandidate(int hduIndex, String hduName, List<String> columns) {
        this.hduIndex = hduIndex;
        this.hduName = hduName;
        this.columns = List.copyOf(columns);
    }

    public int getHduIndex() { return hduIndex; }
    public String getHduName() { return hduName; }
    public List<String> getColumns() { return Collections.unmodifiableList(columns); }

    /**
     * Whether this HDU looks like the science spectrum by name.
     */
    public boolean looksLikeSpectrum() {
        String upper = hduName.toUpperCase();
        return upper.contains("SCI") || upper.equals("SPECTRUM") || upper.equals("SPEC");
    }

    @Override
    public String toString() {
        return String.format("FitsTableCandidate(hdu=%d, name=%s, columns=%s)", hduIndex, hduName, columns);
    }
}
