package com.gbskill.engine.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One labelled input: the text to parse and what the engine should produce.
 *
 * {@code expectedAttributes} maps attribute name to
 * {@code {value, unit?, tolerance?}}.
 *
 * DB table: benchmark_cases
 */
@Entity
@Table(name = "benchmark_cases")
public class BenchmarkCase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "dataset_id", nullable = false)
    private BenchmarkDataset dataset;

    @Column(name = "case_code", nullable = false, unique = true)
    private String caseCode;

    @Column(name = "input_text", nullable = false, columnDefinition = "TEXT")
    private String inputText;

    @Column(name = "expected_skill_id")
    private String expectedSkillId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "expected_attributes", columnDefinition = "json")
    private Map<String, Map<String, Object>> expectedAttributes = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "expected_category", columnDefinition = "json")
    private Map<String, Object> expectedCategory;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CaseDifficulty difficulty = CaseDifficulty.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    private CaseSourceType sourceType = CaseSourceType.SEED;

    // Table name or template code the case was generated from.
    @Column(name = "source_reference")
    private String sourceReference;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "json")
    private List<String> tags = new ArrayList<>();

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected BenchmarkCase() {}   // required by JPA

    public BenchmarkCase(BenchmarkDataset dataset, String caseCode, String inputText) {
        this.dataset   = dataset;
        this.caseCode  = caseCode;
        this.inputText = inputText;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                             getId()                 { return id; }
    public BenchmarkDataset                 getDataset()            { return dataset; }
    public String                           getCaseCode()           { return caseCode; }
    public String                           getInputText()          { return inputText; }
    public String                           getExpectedSkillId()    { return expectedSkillId; }
    public Map<String, Map<String, Object>> getExpectedAttributes() { return expectedAttributes; }
    public Map<String, Object>              getExpectedCategory()   { return expectedCategory; }
    public CaseDifficulty                   getDifficulty()         { return difficulty; }
    public CaseSourceType                   getSourceType()         { return sourceType; }
    public String                           getSourceReference()    { return sourceReference; }
    public List<String>                     getTags()               { return tags; }
    public boolean                          isActive()              { return active; }
    public Instant                          getCreatedAt()          { return createdAt; }

    public void setExpectedSkillId(String v)                          { this.expectedSkillId = v; }
    public void setExpectedAttributes(Map<String, Map<String, Object>> v) { this.expectedAttributes = v; }
    public void setExpectedCategory(Map<String, Object> v)            { this.expectedCategory = v; }
    public void setDifficulty(CaseDifficulty v)                       { this.difficulty = v; }
    public void setSourceType(CaseSourceType v)                       { this.sourceType = v; }
    public void setSourceReference(String v)                          { this.sourceReference = v; }
    public void setTags(List<String> v)                               { this.tags = v; }
    public void setActive(boolean v)                                  { this.active = v; }
}
