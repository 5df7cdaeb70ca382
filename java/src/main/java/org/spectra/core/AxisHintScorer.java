package org.spectra.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ranks table columns as X (independent) or Y (dependent) axis candidates by
 * how their names match physical-quantity vocabularies.
 *
 * <p>Scores:
 * <ul>
 *   <li>X: +10 per {@link #X_HINTS} term.</li>
 *   <li>Y: +10 per {@link #Y_HINTS} term, -50 per time term, -20 per error
 *       term, -10 per bookkeeping term.</li>
 * </ul>
 * Ties always go to the lowest column index.
 */
public final class AxisHintScorer {
    private static final Logger log = LoggerFactory.getLogger(AxisHintScorer.class);

    public static final int HINT_SCORE = 10;
    public static final int TIME_PENALTY = -50;
    public static final int ERROR_PENALTY = -20;

    private static final String[] TIME_TERMS = {"time", "mjd", "jd", "bjd", "epoch"};

    public static final HintTable TIME_HINTS = HintTable.of(HINT_SCORE, TIME_TERMS);

    public static final HintTable X_HINTS = HintTable.of(HINT_SCORE,
        "wavelength", "wave", "lambda", "frequency", "freq", "wavenumber", "wnum")
        .with(HINT_SCORE, TIME_TERMS);

    public static final HintTable Y_HINTS = HintTable.of(HINT_SCORE,
        "flux", "flx", "fnu", "f_lambda", "f_lam", "spec", "sci",
        "counts", "intensity", "rate", "sap_flux", "pdcsap_flux");

    public static final HintTable ERROR_HINTS = HintTable.of(ERROR_PENALTY,
        "err", "unc", "sigma", "ivar", "var", "std");

    public static final HintTable BOOKKEEPING_HINTS = HintTable.of(-HINT_SCORE,
        "corr", "quality", "flag", "status", "mask", "dq", "bkg", "background");

    private static final HintTable Y_TIME_PENALTIES = HintTable.of(TIME_PENALTY, TIME_TERMS);

    private AxisHintScorer() {
    }

    public static int xScore(String name) {
        return X_HINTS.score(name);
    }

    public static int yScore(String name) {
        return Y_HINTS.score(name)
            + Y_TIME_PENALTIES.score(name)
            + ERROR_HINTS.score(name)
            + BOOKKEEPING_HINTS.score(name);
    }

    public static boolean isTimeLike(String name) {
        return TIME_HINTS.matches(name);
    }

    public static boolean isErrorLike(String name) {
        return ERROR_HINTS.matches(name);
    }

    public static boolean isBookkeeping(String name) {
        return BOOKKEEPING_HINTS.matches(name);
    }

    public static AxisSuggestion suggest(List<ColumnInfo> columns) {
        Integer x = suggestX(columns);
        Integer y = suggestY(columns, x);
        log.debug("Axis hints over {} columns -> x={}, y={}", columns.size(), x, y);
        return new AxisSuggestion(x, y);
    }

    /**
     * Best X-hinted numeric column with a strictly positive score; otherwise
     * the first time-like numeric column; otherwise the first numeric column.
     */
    public static Integer suggestX(List<ColumnInfo> columns) {
        Integer best = null;
        int bestScore = 0;
        for (ColumnInfo c : columns) {
            if (!c.isNumeric()) continue;
            int score = xScore(c.getName());
            if (score > bestScore) {
                best = c.getIndex();
                bestScore = score;
            }
        }
        if (best != null) return best;

        for (ColumnInfo c : columns) {
            if (c.isNumeric() && isTimeLike(c.getName())) return c.getIndex();
        }
        for (ColumnInfo c : columns) {
            if (c.isNumeric()) return c.getIndex();
        }
        return null;
    }

    /**
     * Y column, falling back through: best-hinted non-time non-error column,
     * any non-time column without error or bookkeeping hints, any numeric
     * column other than X.
     */
    public static Integer suggestY(List<ColumnInfo> columns, Integer xIndex) {
        Integer best = null;
        int bestScore = 0;
        for (ColumnInfo c : columns) {
            if (!isYCandidate(c, xIndex)) continue;
            String name = c.getName();
            if (isTimeLike(name) || isErrorLike(name)) continue;
            int score = yScore(name);
            if (score > bestScore) {
                best = c.getIndex();
                bestScore = score;
            }
        }
        if (best != null) return best;

        for (ColumnInfo c : columns) {
            if (!isYCandidate(c, xIndex)) continue;
            String name = c.getName();
            if (!isTimeLike(name) && !isErrorLike(name) && !isBookkeeping(name)) {
                return c.getIndex();
            }
        }
        for (ColumnInfo c : columns) {
            if (isYCandidate(c, xIndex)) return c.getIndex();
        }
        return null;
    }

    private static boolean isYCandidate(ColumnInfo c, Integer xIndex) {
        return c.isNumeric() && (xIndex == null || c.getIndex() != xIndex);
    }
}
