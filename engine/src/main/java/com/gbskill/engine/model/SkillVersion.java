package com.gbskill.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of one DSL revision; rows are written once and never
 * updated. The newest row is the skill's current DSL.
 *
 * DB table: skill_versions
 */
@Entity
@Table(name = "skill_versions")
public class SkillVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "skill_ref", nullable = false)
    private Skill skill;

    @Column(nullable = false, updatable = false)
    private String version;

    @Column(name = "dsl_content", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String dslContent;

    @Column(name = "change_log", updatable = false, columnDefinition = "TEXT")
    private String changeLog;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected SkillVersion() {}   // required by JPA

    public SkillVersion(Skill skill, String version, String dslContent, String changeLog) {
        this.skill      = skill;
        this.version    = version;
        this.dslContent = dslContent;
        this.changeLog  = changeLog;
    }

    public UUID    getId()         { return id; }
    public Skill   getSkill()      { return skill; }
    public String  getVersion()    { return version; }
    public String  getDslContent() { return dslContent; }
    public String  getChangeLog()  { return changeLog; }
    public Instant getCreatedAt()  { return createdAt; }
}
