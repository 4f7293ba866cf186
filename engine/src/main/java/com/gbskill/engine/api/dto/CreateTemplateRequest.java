package com.gbskill.engine.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/benchmark/templates.
 *
 * pattern and variants use {placeholder} slots; noiseRules may override the
 * noise prefixes and suffixes.
 */
public record CreateTemplateRequest(
        @NotBlank String     templateCode,
        @NotBlank String     templateName,
        String               domain,
        @NotBlank String     pattern,
        List<String>         variants,
        Map<String, Object>  noiseRules,
        String               description) {}
