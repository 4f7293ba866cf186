package com.gbskill.engine.runtime;

import com.gbskill.engine.dsl.CompiledSkill;

import java.util.Map;

/**
 * Outcome of skill selection.
 *
 * @param skill     the winning skill, or null when no skill scored above zero
 * @param score     the winner's score in [0, 1]
 * @param allScores every candidate's score, in visiting order
 */
public record SkillMatch(CompiledSkill skill, double score, Map<String, Double> allScores) {

    public boolean matched() {
        return skill != null;
    }

    public String skillId() {
        return skill == null ? null : skill.skillId();
    }
}
