package com.gbskill.engine.benchmark.evaluation;

/**
 * Scoring knobs fixed when a run is created.
 *
 * @param tolerance      relative error accepted for numeric attributes that
 *                       carry no tolerance of their own; must be positive
 * @param partialMatch   whether near-miss strings earn fuzzy partial credit
 * @param skipSkillMatch when true, a wrong skill does not fail the case
 */
public record EvaluationConfig(Double tolerance, Boolean partialMatch, Boolean skipSkillMatch) {

    public static final double DEFAULT_TOLERANCE = 0.05;

    public EvaluationConfig {
        if (tolerance == null) tolerance = DEFAULT_TOLERANCE;
        if (partialMatch == null) partialMatch = Boolean.TRUE;
        if (skipSkillMatch == null) skipSkillMatch = Boolean.FALSE;
        if (tolerance <= 0.0 || tolerance.isNaN()) {
            throw new IllegalArgumentException("tolerance must be positive, was " + tolerance);
        }
    }

    public static EvaluationConfig defaults() {
        return new EvaluationConfig(null, null, null);
    }
}
