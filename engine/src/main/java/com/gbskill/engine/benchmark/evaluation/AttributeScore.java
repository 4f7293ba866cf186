package com.gbskill.engine.benchmark.evaluation;

/**
 * Verdict on a single attribute.
 *
 * @param score in [0, 1]; 0 for MISSING and MISMATCH
 */
public record AttributeScore(Object expected, Object actual, boolean match, double score, MatchType type) {

    public static AttributeScore missing(Object expected) {
        return new AttributeScore(expected, null, false, 0.0, MatchType.MISSING);
    }

    public static AttributeScore extra(Object actual) {
        return new AttributeScore(null, actual, false, 0.0, MatchType.EXTRA);
    }
}
