package com.gbskill.engine.api.dto;

import com.gbskill.engine.model.GenerationTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record TemplateResponse(
        UUID                id,
        String              templateCode,
        String              templateName,
        String              domain,
        String              pattern,
        List<String>        variants,
        Map<String, Object> noiseRules,
        String              description,
        boolean             active,
        Instant             createdAt
) {
    public static TemplateResponse from(GenerationTemplate t) {
        return new TemplateResponse(
                t.getId(),
                t.getTemplateCode(),
                t.getTemplateName(),
                t.getDomain(),
                t.getPattern(),
                t.getVariants(),
                t.getNoiseRules(),
                t.getDescription(),
                t.isActive(),
                t.getCreatedAt()
        );
    }
}
