package com.gbskill.engine.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request body for POST /api/v1/benchmark/datasets/{id}/generate-from-template.
 *
 * values maps each template placeholder to the values to combine.
 */
public record TemplateGenerateRequest(
        @NotNull UUID                               templateId,
        @NotEmpty Map<String, @NotNull List<Object>> values,
        @Min(1) @Max(1000) int                      count,
        String                                      difficulty) {}
