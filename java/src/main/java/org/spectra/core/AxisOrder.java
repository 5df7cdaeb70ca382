package org.spectra.core;

/**
 * Ordering class of an X axis.
 */
public enum AxisOrder {
    UNCLASSIFIED,   // fewer than 3 points
    NONDECREASING,
    NONINCREASING,
    NONMONOTONIC
}
