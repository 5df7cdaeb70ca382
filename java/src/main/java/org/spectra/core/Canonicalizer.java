package org.spectra.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Brings paired X/Y arrays into canonical form: equal length, finite values
 * only, X in non-decreasing order.
 */
public final class Canonicalizer {
    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private Canonicalizer() {
    }

    /**
     * Result of one canonicalization pass.
     */
    public static final class Result {
        private final double[] x;
        private final double[] y;
        private final AxisOrder order;
        private final CanonicalAction action;
        private final int droppedNonFinite;
        private final boolean truncated;
        private final List<String> warnings;

        Result(double[] x, double[] y, AxisOrder order, CanonicalAction action,
               int droppedNonFinite, boolean truncated, List<String> warnings) {
            this.x = x;
            this.y = y;
            this.order = order;
            this.action = action;
            this.droppedNonFinite = droppedNonFinite;
            this.truncated = truncated;
            this.warnings = List.copyOf(warnings);
        }

        public double[] getX() { return x; }
        public double[] getY() { return y; }
        public AxisOrder getOrder() { return order; }
        public CanonicalAction getAction() { return action; }
        public int getDroppedNonFinite() { return droppedNonFinite; }
        public boolean isTruncated() { return truncated; }
        public List<String> getWarnings() { return warnings; }
    }

    public static Result canonicalize(double[] x, double[] y) {
        List<String> warnings = new ArrayList<>();

        // 1. equal length
        int n = Math.min(x.length, y.length);
        boolean truncated = x.length != y.length;
        if (truncated) {
            warnings.add("Parsed X and Y lengths differ; truncating to shortest length.");
        }

        // 2. finite pairs only
        double[] fx = new double[n];
        double[] fy = new double[n];
        int kept = 0;
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                fx[kept] = x[i];
                fy[kept] = y[i];
                kept++;
            }
        }
        int dropped = n - kept;
        if (dropped > 0) {
            fx = Arrays.copyOf(fx, kept);
            fy = Arrays.copyOf(fy, kept);
            warnings.add(String.format("Dropped %d non-finite X/Y pair(s) (NaN or Infinity).", dropped));
        }

        // 3. classify, 4. repair
        AxisOrder order = classify(fx);
        CanonicalAction action = CanonicalAction.NONE;
        if (order == AxisOrder.NONINCREASING) {
            reverse(fx);
            reverse(fy);
            action = CanonicalAction.REVERSED;
            warnings.add("X axis was decreasing; reversed order for canonical plotting.");
        } else if (order == AxisOrder.NONMONOTONIC) {
            sortByX(fx, fy);
            action = CanonicalAction.SORTED;
            warnings.add("X axis was non-monotonic; sorted by X (stable) for canonical plotting.");
        }

        log.debug("Canonicalized {} pairs: order={}, action={}, dropped={}", kept, order, action, dropped);
        return new Result(fx, fy, order, action, dropped, truncated, warnings);
    }

    /**
     * Classify X ordering. Equal neighbours count for both directions, so a
     * constant axis is non-decreasing.
     */
    public static AxisOrder classify(double[] values) {
        if (values.length < 3) return AxisOrder.UNCLASSIFIED;

        boolean nondecreasing = true;
        boolean nonincreasing = true;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[i-1]) nondecreasing = false;
            if (values[i] > values[i-1]) nonincreasing = false;
        }
        if (nondecreasing) return AxisOrder.NONDECREASING;
        if (nonincreasing) return AxisOrder.NONINCREASING;
        return AxisOrder.NONMONOTONIC;
    }

    private static void reverse(double[] values) {
        for (int i = 0, j = values.length - 1; i < j; i++, j--) {
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }

    /**
     * Sort both arrays in place by X ascending; ties keep their original order.
     */
    private static void sortByX(double[] x, double[] y) {
        if (x.length <= 1) return;

        Integer[] indices = new Integer[x.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;

        // object sort is stable
        Arrays.sort(indices, Comparator.comparingDouble(i -> x[i]));

        double[] newX = new double[x.length];
        double[] newY = new double[y.length];
        for (int i = 0; i < indices.length; i++) {
            newX[i] = x[indices[i]];
            newY[i] = y[indices[i]];
        }
        System.arraycopy(newX, 0, x, 0, x.length);
        System.arraycopy(newY, 0, y, 0, y.length);
    }
}
