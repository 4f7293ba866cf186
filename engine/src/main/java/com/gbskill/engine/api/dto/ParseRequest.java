package com.gbskill.engine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/v1/material-parse/single.
 *
 * traceId is optional; the engine generates one when it is absent.
 */
public record ParseRequest(
        @NotBlank @Size(max = 1000) String inputText,
        String traceId) {}
