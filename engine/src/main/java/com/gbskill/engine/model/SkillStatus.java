package com.gbskill.engine.model;

/**
 * Lifecycle of a Skill.
 *
 *   DRAFT → TESTING → ACTIVE → DEPRECATED
 *
 * Only ACTIVE skills are candidates for matching, unless none is active,
 * in which case every skill is.
 */
public enum SkillStatus {
    DRAFT,
    TESTING,
    ACTIVE,
    DEPRECATED
}
