package com.gbskill.engine.benchmark.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expected value of one attribute, with an optional per-attribute tolerance
 * overriding the run's.
 */
public record ExpectedAttribute(Object value, String unit, Double tolerance) {

    /**
     * Reads the stored form. A map holding a {@code value} key is taken as the
     * full form; anything else is the bare value.
     */
    @SuppressWarnings("unchecked")
    public static ExpectedAttribute from(Object stored) {
        if (stored instanceof Map<?, ?> m && m.containsKey("value")) {
            Map<String, Object> map = (Map<String, Object>) m;
            Object unit = map.get("unit");
            Object tol = map.get("tolerance");
            return new ExpectedAttribute(map.get("value"),
                    unit == null ? null : unit.toString(),
                    tol instanceof Number n ? n.doubleValue() : null);
        }
        return new ExpectedAttribute(stored, null, null);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("value", value);
        if (unit != null) m.put("unit", unit);
        if (tolerance != null) m.put("tolerance", tolerance);
        return m;
    }
}
