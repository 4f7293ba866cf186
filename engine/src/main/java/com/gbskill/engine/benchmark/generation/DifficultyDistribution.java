package com.gbskill.engine.benchmark.generation;

import com.gbskill.engine.model.CaseDifficulty;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits a requested case count across difficulties.
 *
 * Each bucket gets {@code floor(count × pct / 100)}; whatever rounding leaves
 * over goes to the first bucket. Without percentages the split is
 * 40 / 30 / 20 / remainder.
 */
public final class DifficultyDistribution {

    static final double MIN_TOTAL_PCT = 95.0;
    static final double MAX_TOTAL_PCT = 105.0;

    private DifficultyDistribution() {}

    /**
     * @param percentages difficulty key → percentage; unknown keys are ignored
     * @throws IllegalArgumentException if the known percentages do not sum to roughly 100
     */
    public static Map<CaseDifficulty, Integer> allocate(Map<String, ? extends Number> percentages, int count) {
        Map<CaseDifficulty, Double> known = new LinkedHashMap<>();
        if (percentages != null) {
            percentages.forEach((key, pct) -> {
                CaseDifficulty d = CaseDifficulty.fromKey(key);
                if (d != null && pct != null) known.merge(d, pct.doubleValue(), Double::sum);
            });
        }
        if (known.isEmpty()) {
            return defaults(count);
        }

        double sum = known.values().stream().mapToDouble(Double::doubleValue).sum();
        if (sum < MIN_TOTAL_PCT || sum > MAX_TOTAL_PCT) {
            throw new IllegalArgumentException(
                    "difficulty percentages must sum to about 100, got " + sum);
        }

        Map<CaseDifficulty, Integer> out = new LinkedHashMap<>();
        int remaining = count;
        for (Map.Entry<CaseDifficulty, Double> e : known.entrySet()) {
            int n = (int) Math.floor(count * e.getValue() / 100.0);
            out.put(e.getKey(), n);
            remaining -= n;
        }
        if (remaining > 0) {
            CaseDifficulty first = out.keySet().iterator().next();
            out.merge(first, remaining, Integer::sum);
        }
        return out;
    }

    static Map<CaseDifficulty, Integer> defaults(int count) {
        int easy = (int) (count * 0.4);
        int medium = (int) (count * 0.3);
        int hard = (int) (count * 0.2);
        Map<CaseDifficulty, Integer> out = new EnumMap<>(CaseDifficulty.class);
        out.put(CaseDifficulty.EASY, easy);
        out.put(CaseDifficulty.MEDIUM, medium);
        out.put(CaseDifficulty.HARD, hard);
        out.put(CaseDifficulty.ADVERSARIAL, count - easy - medium - hard);
        return out;
    }
}
