package com.gbskill.engine.api.dto;

import jakarta.validation.constraints.NotBlank;

/** Request body for POST /api/v1/benchmark/datasets. skillId is optional. */
public record CreateDatasetRequest(
        @NotBlank String datasetCode,
        @NotBlank String datasetName,
        String           description,
        String           skillId) {}
