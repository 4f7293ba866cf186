package com.gbskill.engine.api.dto;

import com.gbskill.engine.benchmark.evaluation.BenchmarkMetrics;
import com.gbskill.engine.benchmark.evaluation.EvaluationConfig;
import com.gbskill.engine.model.BenchmarkRun;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * View of a run for polling. metrics stays null until the run completes.
 */
public record RunResponse(
        UUID             id,
        String           runCode,
        UUID             datasetId,
        String           runName,
        String           description,
        EvaluationConfig config,
        String           status,
        int              totalCases,
        int              completedCases,
        double           progress,
        Instant          startedAt,
        Instant          completedAt,
        BenchmarkMetrics metrics,
        String           errorMessage,
        Instant          createdAt
) {
    public static RunResponse from(BenchmarkRun r) {
        return new RunResponse(
                r.getId(),
                r.getRunCode(),
                r.getDataset().getId(),
                r.getRunName(),
                r.getDescription(),
                r.getConfig(),
                r.getStatus().name().toLowerCase(Locale.ROOT),
                r.getTotalCases(),
                r.getCompletedCases(),
                r.getProgress(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getMetrics(),
                r.getErrorMessage(),
                r.getCreatedAt()
        );
    }
}
