package com.gbskill.engine.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A named collection of labelled cases, optionally tied to the skill it was
 * generated from.
 *
 * DB table: benchmark_datasets
 */
@Entity
@Table(name = "benchmark_datasets")
public class BenchmarkDataset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "dataset_code", nullable = false, unique = true)
    private String datasetCode;

    @Column(name = "dataset_name", nullable = false)
    private String datasetName;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Nullable: hand-built seed datasets need no skill.
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "skill_ref")
    private Skill skill;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    private DatasetSourceType sourceType = DatasetSourceType.SEED;

    // difficulty key → case count, merged after each generation.
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "difficulty_distribution", columnDefinition = "json")
    private Map<String, Integer> difficultyDistribution = new LinkedHashMap<>();

    @Column(name = "total_cases", nullable = false)
    private int totalCases = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DatasetStatus status = DatasetStatus.DRAFT;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected BenchmarkDataset() {}   // required by JPA

    public BenchmarkDataset(String datasetCode, String datasetName) {
        this.datasetCode = datasetCode;
        this.datasetName = datasetName;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                 getId()                     { return id; }
    public String               getDatasetCode()            { return datasetCode; }
    public String               getDatasetName()            { return datasetName; }
    public String               getDescription()            { return description; }
    public Skill                getSkill()                  { return skill; }
    public DatasetSourceType    getSourceType()             { return sourceType; }
    public Map<String, Integer> getDifficultyDistribution() { return difficultyDistribution; }
    public int                  getTotalCases()             { return totalCases; }
    public DatasetStatus        getStatus()                 { return status; }
    public Instant              getCreatedAt()              { return createdAt; }
    public Instant              getUpdatedAt()              { return updatedAt; }

    public void setDescription(String v)                        { this.description = v; }
    public void setSkill(Skill v)                               { this.skill = v; }
    public void setSourceType(DatasetSourceType v)              { this.sourceType = v; }
    public void setDifficultyDistribution(Map<String, Integer> v) { this.difficultyDistribution = v; }
    public void setTotalCases(int v)                            { this.totalCases = v; }
    public void setStatus(DatasetStatus v)                      { this.status = v; }
}
