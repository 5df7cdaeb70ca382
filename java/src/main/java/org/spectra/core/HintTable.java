package org.spectra.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Substring vocabulary with a score per term. A name scores the sum of the
 * weights of every term it contains (case-insensitive).
 */
public final class HintTable {
    private final Map<String, Integer> weights;

    private HintTable(Map<String, Integer> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static HintTable of(int weight, String... terms) {
        Map<String, Integer> weights = new LinkedHashMap<>();
        for (String term : terms) {
            weights.put(term.toLowerCase(Locale.ROOT), weight);
        }
        return new HintTable(weights);
    }

    /**
     * A copy of this table with extra terms at the given weight.
     */
    public HintTable with(int weight, String... terms) {
        Map<String, Integer> merged = new LinkedHashMap<>(weights);
        for (String term : terms) {
            merged.put(term.toLowerCase(Locale.ROOT), weight);
        }
        return new HintTable(merged);
    }

    public int score(String name) {
        if (name == null) return 0;
        String n = name.trim().toLowerCase(Locale.ROOT);
        int score = 0;
        for (Map.Entry<String, Integer> entry : weights.entrySet()) {
            if (n.contains(entry.getKey())) {
                score += entry.getValue();
            }
        }
        return score;
    }

    public boolean matches(String name) {
        if (name == null) return false;
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (String term : weights.keySet()) {
            if (n.contains(term)) return true;
        }
        return false;
    }
}
