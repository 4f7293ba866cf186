package com.gbskill.engine.api.dto;

import com.gbskill.engine.benchmark.GenerationOptions;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for POST /api/v1/benchmark/datasets/{id}/generate.
 *
 * difficultyDistribution maps difficulty keys to percentages summing to 100;
 * omitted, cases split 40/30/20/10. includeVariants defaults to true.
 */
public record GenerateRequest(
        @NotBlank String             skillId,
        @Min(1) @Max(1000) int       count,
        Map<String, Integer>         difficultyDistribution,
        boolean                      includeNoise,
        Boolean                      includeVariants
) {
    public GenerationOptions toOptions() {
        return new GenerationOptions(skillId, count, difficultyDistribution, includeNoise,
                includeVariants == null || includeVariants);
    }
}
