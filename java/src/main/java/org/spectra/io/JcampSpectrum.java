package org.spectra.io;

import java.util.*;

/**
 * Contents of a JCAMP-DX file: labelled header tags and one decoded data block.
 */
public class JcampSpectrum {
    private final Map<String, String> header;
    private final String mode;
    private final double[] x;
    private final double[] y;
    private final List<String> warnings;

    public JcampSpectrum(Map<String, String> header, String mode, double[] x, double[] y, List<String> warnings) {
        this.header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
        this.mode = mode;
        this.x = x;
        this.y = y;
        this.warnings = List.copyOf(warnings);
    }

    public Map<String, String> getHeader() { return header; }

    /** Data encoding, e.g. {@code x++(y..y)}, or null when no block was found. */
    public String getMode() { return mode; }

    public double[] getX() { return x; }
    public double[] getY() { return y; }
    public int size() { return x.length; }

    public List<String> getWarnings() { return warnings; }

    public String getTitle() { return header.get("TITLE"); }
    public String getXUnit() { return header.get("XUNITS"); }
    public String getYUnit() { return header.get("YUNITS"); }
}
