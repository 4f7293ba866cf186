package com.gbskill.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A compiled ruleset for one standards document.
 *
 * The DSL is stored as JSON text rather than a JSON column so that attribute
 * and table order survive a store/load cycle byte for byte. Replacing the DSL
 * bumps {@code dslVersion} and writes a new {@link SkillVersion}; history rows
 * are never edited.
 *
 * DB table: skills  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "skills")
public class Skill {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Business key, e.g. "skill_gb_t_4219_1_2021".
    @Column(name = "skill_id", nullable = false, unique = true)
    private String skillId;

    @Column(name = "skill_name", nullable = false)
    private String skillName;

    @Column(nullable = false)
    private String domain;

    // Higher wins when two skills score the same.
    @Column(nullable = false)
    private int priority = 100;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SkillStatus status = SkillStatus.DRAFT;

    @Column(name = "dsl_version", nullable = false)
    private String dslVersion = "1.0.0";

    @Column(name = "dsl_content", nullable = false, columnDefinition = "TEXT")
    private String dslContent;

    @Column(name = "standard_code")
    private String standardCode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Skill() {}   // required by JPA

    public Skill(String skillId, String skillName, String domain, String dslContent) {
        this.skillId    = skillId;
        this.skillName  = skillName;
        this.domain     = domain;
        this.dslContent = dslContent;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()           { return id; }
    public String      getSkillId()      { return skillId; }
    public String      getSkillName()    { return skillName; }
    public String      getDomain()       { return domain; }
    public int         getPriority()     { return priority; }
    public SkillStatus getStatus()       { return status; }
    public String      getDslVersion()   { return dslVersion; }
    public String      getDslContent()   { return dslContent; }
    public String      getStandardCode() { return standardCode; }
    public Instant     getCreatedAt()    { return createdAt; }
    public Instant     getUpdatedAt()    { return updatedAt; }

    public void setSkillName(String skillName)       { this.skillName = skillName; }
    public void setDomain(String domain)             { this.domain = domain; }
    public void setPriority(int priority)            { this.priority = priority; }
    public void setStatus(SkillStatus status)        { this.status = status; }
    public void setDslVersion(String dslVersion)     { this.dslVersion = dslVersion; }
    public void setDslContent(String dslContent)     { this.dslContent = dslContent; }
    public void setStandardCode(String standardCode) { this.standardCode = standardCode; }
}
