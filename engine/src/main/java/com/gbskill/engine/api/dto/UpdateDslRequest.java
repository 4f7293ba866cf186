package com.gbskill.engine.api.dto;

import jakarta.validation.constraints.NotNull;

/** Request body for PUT /api/v1/skills/{skillId}/dsl. */
public record UpdateDslRequest(@NotNull Object dsl, String changeLog) {}
