package com.gbskill.engine.api.dto;

import com.gbskill.engine.model.CaseDifficulty;

import java.util.ArrayList;
import java.util.List;

/** Request-side parsing of difficulty keys ({@code easy}, {@code hard}, ...). */
public final class Difficulties {

    private Difficulties() {}

    /** Null or blank gives null; an unknown key is rejected. */
    public static CaseDifficulty parse(String key) {
        if (key == null || key.isBlank()) return null;
        CaseDifficulty d = CaseDifficulty.fromKey(key);
        if (d == null) {
            throw new IllegalArgumentException("Unknown difficulty: " + key);
        }
        return d;
    }

    public static CaseDifficulty parseOrDefault(String key, CaseDifficulty fallback) {
        CaseDifficulty d = parse(key);
        return d != null ? d : fallback;
    }

    public static List<CaseDifficulty> parseAll(List<String> keys) {
        List<CaseDifficulty> out = new ArrayList<>();
        if (keys == null) return out;
        for (String k : keys) {
            CaseDifficulty d = parse(k);
            if (d != null) out.add(d);
        }
        return out;
    }
}
