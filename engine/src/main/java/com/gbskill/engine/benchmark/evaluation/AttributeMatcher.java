package com.gbskill.engine.benchmark.evaluation;

import com.gbskill.engine.runtime.Scalars;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores actual attribute values against expected ones.
 *
 * Per attribute, the first applicable rule wins:
 * <ol>
 *   <li>no actual value: MISSING, 0</li>
 *   <li>equal values (numbers by value): EXACT, 1</li>
 *   <li>strings equal after lower-casing and dropping spaces, hyphens and underscores: NORMALIZED, 1</li>
 *   <li>both numeric with relative error e ≤ tolerance t: TOLERANCE, {@code 1 − 0.5·e/t}</li>
 *   <li>partial matching on and character-set Jaccard overlap j &gt; 0.5: FUZZY, {@code 0.5·j}</li>
 *   <li>otherwise MISMATCH, 0</li>
 * </ol>
 * The case score is the mean over expected attributes. Attributes the engine
 * produced but nobody expected are recorded as {@code _extra_<name>} and do
 * not affect the score.
 */
public class AttributeMatcher {

    public static final String EXTRA_PREFIX = "_extra_";

    private final EvaluationConfig config;

    public AttributeMatcher(EvaluationConfig config) {
        this.config = config;
    }

    /** Per-attribute scores and their mean. */
    public record CaseScore(Map<String, AttributeScore> scores, double overallScore) {}

    /**
     * @param expected attribute → stored expectation ({@code {value, unit, tolerance}} or bare value)
     * @param actual   attribute → engine output ({@code {value, ...}} or bare value)
     */
    public CaseScore matchAll(Map<String, ?> expected, Map<String, ?> actual) {
        Map<String, AttributeScore> scores = new LinkedHashMap<>();
        double total = 0.0;

        for (Map.Entry<String, ?> e : expected.entrySet()) {
            ExpectedAttribute exp = ExpectedAttribute.from(e.getValue());
            Object act = actual == null ? null : valueOf(actual.get(e.getKey()));
            double tolerance = exp.tolerance() != null && exp.tolerance() > 0 ? exp.tolerance() : config.tolerance();
            AttributeScore score = match(exp.value(), act, tolerance);
            scores.put(e.getKey(), score);
            total += score.score();
        }

        if (actual != null) {
            for (Map.Entry<String, ?> a : actual.entrySet()) {
                if (!expected.containsKey(a.getKey()) && !a.getKey().startsWith("_")) {
                    scores.put(EXTRA_PREFIX + a.getKey(), AttributeScore.extra(valueOf(a.getValue())));
                }
            }
        }

        double overall = expected.isEmpty() ? 0.0 : total / expected.size();
        return new CaseScore(scores, overall);
    }

    public AttributeScore match(Object expected, Object actual, double tolerance) {
        if (actual == null) {
            return AttributeScore.missing(expected);
        }
        if (Scalars.sameValue(expected, actual)) {
            return new AttributeScore(expected, actual, true, 1.0, MatchType.EXACT);
        }
        if (expected instanceof String e && actual instanceof String a && normalize(e).equals(normalize(a))) {
            return new AttributeScore(expected, actual, true, 1.0, MatchType.NORMALIZED);
        }

        Double exp = Scalars.toDouble(expected);
        Double act = Scalars.toDouble(actual);
        if (tolerance > 0 && exp != null && act != null) {
            if (exp == 0.0) {
                if (act == 0.0) {
                    return new AttributeScore(expected, actual, true, 1.0, MatchType.EXACT);
                }
            } else {
                double error = Math.abs(exp - act) / Math.abs(exp);
                if (error <= tolerance) {
                    return new AttributeScore(expected, actual, true, 1.0 - 0.5 * (error / tolerance),
                            MatchType.TOLERANCE);
                }
            }
        }

        if (config.partialMatch()) {
            double overlap = characterOverlap(expected, actual);
            if (overlap > 0.5) {
                return new AttributeScore(expected, actual, false, 0.5 * overlap, MatchType.FUZZY);
            }
        }
        return new AttributeScore(expected, actual, false, 0.0, MatchType.MISMATCH);
    }

    static String normalize(String s) {
        return s.toLowerCase(Locale.ROOT).strip()
                .replace(" ", "")
                .replace("-", "")
                .replace("_", "");
    }

    /** Jaccard similarity of the character sets of both values' text forms. */
    static double characterOverlap(Object expected, Object actual) {
        String a = String.valueOf(expected);
        String b = String.valueOf(actual);
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<Integer> setA = new HashSet<>();
        a.codePoints().forEach(setA::add);
        Set<Integer> setB = new HashSet<>();
        b.codePoints().forEach(setB::add);
        Set<Integer> union = new HashSet<>(setA);
        union.addAll(setB);
        setA.retainAll(setB);
        return (double) setA.size() / union.size();
    }

    private static Object valueOf(Object attribute) {
        if (attribute instanceof Map<?, ?> m) {
            return m.get("value");
        }
        return attribute;
    }
}
