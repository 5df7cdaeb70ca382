package org.spectra.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalizerTest {

    @Test
    void decreasing_axis_is_reversed() {
        Canonicalizer.Result r = Canonicalizer.canonicalize(new double[]{3, 2, 1}, new double[]{30, 20, 10});

        assertArrayEquals(new double[]{1, 2, 3}, r.getX());
        assertArrayEquals(new double[]{10, 20, 30}, r.getY());
        assertEquals(AxisOrder.NONINCREASING, r.getOrder());
        assertEquals(CanonicalAction.REVERSED, r.getAction());
        assertTrue(r.getWarnings().contains("X axis was decreasing; reversed order for canonical plotting."));
    }

    @Test
    void non_monotonic_axis_is_stably_sorted() {
        Canonicalizer.Result r = Canonicalizer.canonicalize(new double[]{2, 1, 2, 0}, new double[]{1, 2, 3, 4});

        assertArrayEquals(new double[]{0, 1, 2, 2}, r.getX());
        assertArrayEquals(new double[]{4, 2, 1, 3}, r.getY());
        assertEquals(CanonicalAction.SORTED, r.getAction());
    }

    @Test
    void non_finite_pairs_are_dropped() {
        Canonicalizer.Result r = Canonicalizer.canonicalize(
            new double[]{1, Double.NaN, 3, 4, 5},
            new double[]{1, 2, Double.POSITIVE_INFINITY, 4, 5});

        assertArrayEquals(new double[]{1, 4, 5}, r.getX());
        assertArrayEquals(new double[]{1, 4, 5}, r.getY());
        assertEquals(2, r.getDroppedNonFinite());
        assertTrue(r.getWarnings().contains("Dropped 2 non-finite X/Y pair(s) (NaN or Infinity)."));
    }

    @Test
    void unequal_lengths_are_truncated() {
        Canonicalizer.Result r = Canonicalizer.canonicalize(new double[]{1, 2, 3, 4}, new double[]{5, 6, 7});

        assertTrue(r.isTruncated());
        assertEquals(3, r.getX().length);
        assertEquals(3, r.getY().length);
        assertTrue(r.getWarnings().contains("Parsed X and Y lengths differ; truncating to shortest length."));
    }

    @Test
    void canonical_output_is_a_fixed_point() {
        Canonicalizer.Result first = Canonicalizer.canonicalize(new double[]{5, 1, 3, 1}, new double[]{1, 2, 3, 4});
        Canonicalizer.Result second = Canonicalizer.canonicalize(first.getX(), first.getY());

        assertArrayEquals(first.getX(), second.getX());
        assertArrayEquals(first.getY(), second.getY());
        assertEquals(CanonicalAction.NONE, second.getAction());
        assertTrue(second.getWarnings().isEmpty());
    }

    @Test
    void short_series_are_left_alone() {
        Canonicalizer.Result r = Canonicalizer.canonicalize(new double[]{2, 1}, new double[]{20, 10});

        assertArrayEquals(new double[]{2, 1}, r.getX());
        assertEquals(AxisOrder.UNCLASSIFIED, r.getOrder());
        assertEquals(CanonicalAction.NONE, r.getAction());
    }

    @Test
    void classification_treats_ties_as_monotonic() {
        assertEquals(AxisOrder.NONDECREASING, Canonicalizer.classify(new double[]{1, 1, 1}));
        assertEquals(AxisOrder.NONDECREASING, Canonicalizer.classify(new double[]{1, 1, 2}));
        assertEquals(AxisOrder.NONINCREASING, Canonicalizer.classify(new double[]{3, 3, 1}));
        assertEquals(AxisOrder.NONMONOTONIC, Canonicalizer.classify(new double[]{1, 3, 2}));
        assertEquals(AxisOrder.UNCLASSIFIED, Canonicalizer.classify(new double[0]));
    }

    @Test
    void inputs_are_not_modified() {
        double[] x = {3, 2, 1};
        double[] y = {1, 2, 3};
        Canonicalizer.canonicalize(x, y);
        assertArrayEquals(new double[]{3, 2, 1}, x);
        assertArrayEquals(new double[]{1, 2, 3}, y);
    }
}
