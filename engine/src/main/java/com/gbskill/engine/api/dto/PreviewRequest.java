package com.gbskill.engine.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/** Request body for POST /api/v1/benchmark/templates/{id}/preview. */
public record PreviewRequest(
        @NotEmpty Map<String, @NotNull List<Object>> values,
        @Min(1) @Max(50) int                        count,
        String                                      difficulty) {}
