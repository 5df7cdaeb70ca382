package org.spectra.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Leading comment or instrument-header lines kept for provenance, and the
 * key/value metadata found in them.
 */
public class Preamble {
    public static final int MAX_LINES = 200;

    private final List<String> lines;
    private final Map<String, String> metadata;

    public Preamble(List<String> lines, Map<String, String> metadata) {
        this.lines = List.copyOf(lines);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public List<String> getLines() { return lines; }
    public Map<String, String> getMetadata() { return metadata; }

    public boolean isEmpty() {
        return lines.isEmpty() && metadata.isEmpty();
    }
}
