package com.gbskill.engine.benchmark;

import com.gbskill.engine.model.CaseDifficulty;

import java.util.List;
import java.util.Map;

/**
 * A hand-written case to add to a dataset.
 *
 * @param expectedAttributes attribute → {@code {value, unit?, tolerance?}} or a bare value
 * @param difficulty         MEDIUM when null
 */
public record NewCase(
        String              inputText,
        String              expectedSkillId,
        Map<String, Object> expectedAttributes,
        Map<String, Object> expectedCategory,
        CaseDifficulty      difficulty,
        List<String>        tags) {}
