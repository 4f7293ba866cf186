package com.gbskill.engine.model;

import java.util.Locale;

/**
 * Difficulty grade of a benchmark case. Controls which input transforms the
 * generator applies and how results are grouped in run metrics.
 */
public enum CaseDifficulty {
    EASY,
    MEDIUM,
    HARD,
    ADVERSARIAL;

    /** Lower-case key used in distributions and metric breakdowns. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a distribution key; returns null for unknown keys. */
    public static CaseDifficulty fromKey(String key) {
        if (key == null) return null;
        for (CaseDifficulty d : values()) {
            if (d.key().equalsIgnoreCase(key.trim())) return d;
        }
        return null;
    }
}
