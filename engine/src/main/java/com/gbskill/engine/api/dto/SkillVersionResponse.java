package com.gbskill.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.gbskill.engine.model.SkillVersion;

import java.time.Instant;

public record SkillVersionResponse(
        String  version,
        String  changeLog,
        boolean active,
        @JsonRawValue String dsl,
        Instant createdAt
) {
    public static SkillVersionResponse from(SkillVersion v, boolean active) {
        return new SkillVersionResponse(v.getVersion(), v.getChangeLog(), active,
                v.getDslContent(), v.getCreatedAt());
    }
}
