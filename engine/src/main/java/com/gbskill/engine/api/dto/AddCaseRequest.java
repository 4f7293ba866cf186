package com.gbskill.engine.api.dto;

import com.gbskill.engine.benchmark.NewCase;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/benchmark/datasets/{id}/cases.
 *
 * expectedAttributes values are either {value, unit, tolerance} objects or bare values.
 */
public record AddCaseRequest(
        @NotBlank String    inputText,
        String              expectedSkillId,
        Map<String, Object> expectedAttributes,
        Map<String, Object> expectedCategory,
        String              difficulty,
        List<String>        tags
) {
    public NewCase toNewCase() {
        return new NewCase(inputText, expectedSkillId, expectedAttributes, expectedCategory,
                Difficulties.parse(difficulty), tags);
    }
}
