package com.gbskill.engine.benchmark.evaluation;

import com.gbskill.engine.model.BenchmarkCase;
import com.gbskill.engine.model.BenchmarkDataset;
import com.gbskill.engine.model.BenchmarkResult;
import com.gbskill.engine.model.BenchmarkRun;
import com.gbskill.engine.model.CaseDifficulty;
import com.gbskill.engine.model.ResultStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsCalculatorTest {

    private final BenchmarkDataset dataset = new BenchmarkDataset("DS_TEST", "test");
    private final BenchmarkRun run = new BenchmarkRun("RUN_TEST", dataset, EvaluationConfig.defaults());

    @Test
    void calculate_overallRatesAndMeans() {
        List<BenchmarkResult> results = List.of(
                result(CaseDifficulty.EASY, ResultStatus.SUCCESS, 1.0, true, 0.9, 10L),
                result(CaseDifficulty.EASY, ResultStatus.PARTIAL, 0.6, true, 0.7, 20L),
                result(CaseDifficulty.HARD, ResultStatus.FAILED, 0.0, false, 0.5, 30L),
                result(CaseDifficulty.HARD, ResultStatus.ERROR, 0.0, null, null, 40L));

        BenchmarkMetrics m = MetricsCalculator.calculate(results);

        assertThat(m.overall().totalCases()).isEqualTo(4);
        assertThat(m.overall().accuracy()).isEqualTo(0.25);
        assertThat(m.overall().partialAccuracy()).isEqualTo(0.5);
        assertThat(m.overall().skillMatchRate()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(m.overall().avgConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(m.overall().avgScore()).isCloseTo(0.4, within(1e-9));
        assertThat(m.overall().avgLatencyMs()).isEqualTo(25.0);
        assertThat(m.byStatus()).containsEntry("success", 1L).containsEntry("error", 1L);
    }

    @Test
    void calculate_groupsByDifficulty() {
        List<BenchmarkResult> results = List.of(
                result(CaseDifficulty.EASY, ResultStatus.SUCCESS, 1.0, true, 0.9, 10L),
                result(CaseDifficulty.EASY, ResultStatus.FAILED, 0.2, true, 0.9, 10L),
                result(CaseDifficulty.ADVERSARIAL, ResultStatus.SUCCESS, 0.95, true, 0.9, 10L));

        BenchmarkMetrics m = MetricsCalculator.calculate(results);

        assertThat(m.byDifficulty()).containsOnlyKeys("easy", "adversarial");
        assertThat(m.byDifficulty().get("easy").count()).isEqualTo(2);
        assertThat(m.byDifficulty().get("easy").accuracy()).isEqualTo(0.5);
        assertThat(m.byDifficulty().get("easy").avgScore()).isCloseTo(0.6, within(1e-9));
        assertThat(m.byDifficulty().get("adversarial").accuracy()).isEqualTo(1.0);
    }

    @Test
    void calculate_groupsByAttributeAndSkipsExtras() {
        BenchmarkResult first = result(CaseDifficulty.MEDIUM, ResultStatus.PARTIAL, 0.5, true, 0.9, 5L);
        first.setAttributeScores(Map.of(
                "公称直径", new AttributeScore(100, 100, true, 1.0, MatchType.EXACT),
                "壁厚", AttributeScore.missing(5.3),
                "_extra_公称外径", AttributeScore.extra(110)));
        BenchmarkResult second = result(CaseDifficulty.MEDIUM, ResultStatus.SUCCESS, 0.9, true, 0.9, 5L);
        second.setAttributeScores(Map.of(
                "公称直径", new AttributeScore(100, 101, true, 0.9, MatchType.TOLERANCE),
                "壁厚", new AttributeScore(5.3, 5.3, true, 1.0, MatchType.EXACT)));

        BenchmarkMetrics m = MetricsCalculator.calculate(List.of(first, second));

        assertThat(m.byAttribute()).containsOnlyKeys("公称直径", "壁厚");
        BenchmarkMetrics.AttributeMetrics dn = m.byAttribute().get("公称直径");
        assertThat(dn.total()).isEqualTo(2);
        assertThat(dn.exactMatchRate()).isEqualTo(0.5);
        assertThat(dn.withinToleranceRate()).isEqualTo(1.0);
        assertThat(m.byAttribute().get("壁厚").missingRate()).isEqualTo(0.5);
    }

    @Test
    void calculate_noSkillEvaluated_rateIsZero() {
        BenchmarkMetrics m = MetricsCalculator.calculate(List.of(
                result(CaseDifficulty.EASY, ResultStatus.SUCCESS, 1.0, null, 0.9, 1L)));

        assertThat(m.overall().skillMatchRate()).isZero();
    }

    @Test
    void calculate_noResults_allZero() {
        BenchmarkMetrics m = MetricsCalculator.calculate(List.of());

        assertThat(m.overall().totalCases()).isZero();
        assertThat(m.overall().accuracy()).isZero();
        assertThat(m.byDifficulty()).isEmpty();
    }

    private BenchmarkResult result(CaseDifficulty difficulty, ResultStatus status, double score,
                                   Boolean skillMatch, Double confidence, Long latency) {
        BenchmarkCase c = new BenchmarkCase(dataset, "CASE_" + System.nanoTime(), "input");
        c.setDifficulty(difficulty);
        BenchmarkResult r = new BenchmarkResult(run, c, status);
        r.setOverallScore(score);
        r.setSkillMatch(skillMatch);
        r.setActualConfidence(confidence);
        r.setExecutionTimeMs(latency);
        return r;
    }
}
