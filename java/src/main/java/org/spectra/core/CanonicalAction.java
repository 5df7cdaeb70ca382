package org.spectra.core;

/**
 * Reordering applied by the {@link Canonicalizer}.
 */
public enum CanonicalAction {
    NONE("none"),
    REVERSED("reversed"),
    SORTED("sorted");

    private final String label;

    CanonicalAction(String label) {
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
