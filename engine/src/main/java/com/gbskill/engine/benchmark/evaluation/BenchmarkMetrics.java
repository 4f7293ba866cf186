package com.gbskill.engine.benchmark.evaluation;

import java.util.Map;

/**
 * Snapshot of a completed run, computed once from all of its results.
 *
 * Rates are fractions in [0, 1], and 0 when their denominator is empty.
 * {@code skillMatchRate} counts only cases that evaluated a skill match.
 */
public record BenchmarkMetrics(
        Overall                         overall,
        Map<String, DifficultyMetrics>  byDifficulty,
        Map<String, AttributeMetrics>   byAttribute,
        Map<String, Long>               byStatus) {

    public record Overall(
            int    totalCases,
            double accuracy,
            double partialAccuracy,
            double skillMatchRate,
            double avgConfidence,
            double avgScore,
            double avgLatencyMs) {}

    public record DifficultyMetrics(int count, double accuracy, double avgScore) {}

    public record AttributeMetrics(
            int    total,
            double exactMatchRate,
            double withinToleranceRate,
            double missingRate) {}
}
