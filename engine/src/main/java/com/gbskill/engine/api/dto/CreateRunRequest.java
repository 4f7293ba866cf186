package com.gbskill.engine.api.dto;

import com.gbskill.engine.benchmark.evaluation.EvaluationConfig;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Request body for POST /api/v1/benchmark/runs.
 *
 * config defaults to {tolerance: 0.05, partialMatch: true, skipSkillMatch: false}.
 */
public record CreateRunRequest(
        @NotNull UUID    datasetId,
        String           runName,
        String           description,
        EvaluationConfig config) {}
