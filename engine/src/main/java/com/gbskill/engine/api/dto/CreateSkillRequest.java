package com.gbskill.engine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for POST /api/v1/skills.
 *
 * dsl is the skill DSL as a JSON object; priority defaults to 100.
 */
public record CreateSkillRequest(
        @NotBlank String skillId,
        @NotBlank String skillName,
        String           domain,
        Integer          priority,
        @NotNull Object  dsl) {}
