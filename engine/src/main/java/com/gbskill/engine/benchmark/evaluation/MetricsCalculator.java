package com.gbskill.engine.benchmark.evaluation;

import com.gbskill.engine.model.BenchmarkResult;
import com.gbskill.engine.model.ResultStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregates a run's results into {@link BenchmarkMetrics}.
 *
 * Each result must have its case loaded; difficulty comes from the case.
 */
public final class MetricsCalculator {

    private MetricsCalculator() {}

    public static BenchmarkMetrics calculate(List<BenchmarkResult> results) {
        int total = results.size();
        int success = 0;
        int partialOrBetter = 0;
        int skillMatched = 0;
        int skillEvaluated = 0;
        double scoreSum = 0.0;
        double confidenceSum = 0.0;
        int confidenceCount = 0;
        long latencySum = 0;

        Map<String, int[]> difficultyCounts = new LinkedHashMap<>();      // [count, success]
        Map<String, Double> difficultyScores = new LinkedHashMap<>();
        Map<String, int[]> attributeCounts = new LinkedHashMap<>();       // [total, exact, tolerance, missing]
        Map<String, Long> byStatus = new LinkedHashMap<>();

        for (BenchmarkResult r : results) {
            ResultStatus status = r.getStatus();
            byStatus.merge(status.name().toLowerCase(Locale.ROOT), 1L, Long::sum);
            if (status == ResultStatus.SUCCESS) {
                success++;
                partialOrBetter++;
            } else if (status == ResultStatus.PARTIAL) {
                partialOrBetter++;
            }
            if (r.getSkillMatch() != null) {
                skillEvaluated++;
                if (r.getSkillMatch()) skillMatched++;
            }
            scoreSum += r.getOverallScore();
            if (r.getActualConfidence() != null) {
                confidenceSum += r.getActualConfidence();
                confidenceCount++;
            }
            if (r.getExecutionTimeMs() != null) {
                latencySum += r.getExecutionTimeMs();
            }

            String difficulty = r.getBenchmarkCase().getDifficulty() == null
                    ? "unknown" : r.getBenchmarkCase().getDifficulty().key();
            int[] d = difficultyCounts.computeIfAbsent(difficulty, k -> new int[2]);
            d[0]++;
            if (status == ResultStatus.SUCCESS) d[1]++;
            difficultyScores.merge(difficulty, r.getOverallScore(), Double::sum);

            if (r.getAttributeScores() != null) {
                r.getAttributeScores().forEach((name, score) -> {
                    if (name.startsWith("_")) return;
                    int[] a = attributeCounts.computeIfAbsent(name, k -> new int[4]);
                    a[0]++;
                    switch (score.type()) {
                        case EXACT, NORMALIZED -> a[1]++;
                        case TOLERANCE -> a[2]++;
                        case MISSING -> a[3]++;
                        default -> { }
                    }
                });
            }
        }

        BenchmarkMetrics.Overall overall = new BenchmarkMetrics.Overall(
                total,
                ratio(success, total),
                ratio(partialOrBetter, total),
                ratio(skillMatched, skillEvaluated),
                confidenceCount == 0 ? 0.0 : confidenceSum / confidenceCount,
                total == 0 ? 0.0 : scoreSum / total,
                total == 0 ? 0.0 : (double) latencySum / total);

        Map<String, BenchmarkMetrics.DifficultyMetrics> byDifficulty = new LinkedHashMap<>();
        difficultyCounts.forEach((k, d) -> byDifficulty.put(k, new BenchmarkMetrics.DifficultyMetrics(
                d[0], ratio(d[1], d[0]), d[0] == 0 ? 0.0 : difficultyScores.get(k) / d[0])));

        Map<String, BenchmarkMetrics.AttributeMetrics> byAttribute = new LinkedHashMap<>();
        attributeCounts.forEach((k, a) -> byAttribute.put(k, new BenchmarkMetrics.AttributeMetrics(
                a[0], ratio(a[1], a[0]), ratio(a[1] + a[2], a[0]), ratio(a[3], a[0]))));

        return new BenchmarkMetrics(overall, byDifficulty, byAttribute, byStatus);
    }

    private static double ratio(int part, int whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }
}
