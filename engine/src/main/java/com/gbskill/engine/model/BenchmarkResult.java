package com.gbskill.engine.model;

import com.gbskill.engine.benchmark.evaluation.AttributeScore;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of evaluating one case within one run. Written once, never edited.
 *
 * DB table: benchmark_results
 */
@Entity
@Table(name = "benchmark_results")
public class BenchmarkResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private BenchmarkRun run;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "case_id", nullable = false)
    private BenchmarkCase benchmarkCase;

    @Column(name = "actual_skill_id")
    private String actualSkillId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "actual_attributes", columnDefinition = "json")
    private Map<String, Object> actualAttributes = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "actual_category", columnDefinition = "json")
    private Map<String, Object> actualCategory;

    @Column(name = "actual_confidence")
    private Double actualConfidence;

    // Null when skill matching was skipped or the case names no expected skill.
    @Column(name = "skill_match")
    private Boolean skillMatch;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "attribute_scores", columnDefinition = "json")
    private Map<String, AttributeScore> attributeScores = new LinkedHashMap<>();

    @Column(name = "overall_score", nullable = false)
    private double overallScore = 0.0;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "trace_id")
    private String traceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ResultStatus status;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected BenchmarkResult() {}   // required by JPA

    public BenchmarkResult(BenchmarkRun run, BenchmarkCase benchmarkCase, ResultStatus status) {
        this.run           = run;
        this.benchmarkCase = benchmarkCase;
        this.status        = status;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                        getId()               { return id; }
    public BenchmarkRun                getRun()              { return run; }
    public BenchmarkCase               getBenchmarkCase()    { return benchmarkCase; }
    public String                      getActualSkillId()    { return actualSkillId; }
    public Map<String, Object>         getActualAttributes() { return actualAttributes; }
    public Map<String, Object>         getActualCategory()   { return actualCategory; }
    public Double                      getActualConfidence() { return actualConfidence; }
    public Boolean                     getSkillMatch()       { return skillMatch; }
    public Map<String, AttributeScore> getAttributeScores()  { return attributeScores; }
    public double                      getOverallScore()     { return overallScore; }
    public Long                        getExecutionTimeMs()  { return executionTimeMs; }
    public String                      getTraceId()          { return traceId; }
    public ResultStatus                getStatus()           { return status; }
    public String                      getErrorMessage()     { return errorMessage; }
    public Instant                     getCreatedAt()        { return createdAt; }

    public void setActualSkillId(String v)                       { this.actualSkillId = v; }
    public void setActualAttributes(Map<String, Object> v)       { this.actualAttributes = v; }
    public void setActualCategory(Map<String, Object> v)         { this.actualCategory = v; }
    public void setActualConfidence(Double v)                    { this.actualConfidence = v; }
    public void setSkillMatch(Boolean v)                         { this.skillMatch = v; }
    public void setAttributeScores(Map<String, AttributeScore> v) { this.attributeScores = v; }
    public void setOverallScore(double v)                        { this.overallScore = v; }
    public void setExecutionTimeMs(Long v)                       { this.executionTimeMs = v; }
    public void setTraceId(String v)                             { this.traceId = v; }
    public void setStatus(ResultStatus v)                        { this.status = v; }
    public void setErrorMessage(String v)                        { this.errorMessage = v; }
}
