package com.gbskill.engine.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Audit record of one pipeline execution: what came in, which skill handled
 * it, every engine step, and what came out.
 *
 * Written once when the execution ends, successful or not, and never updated.
 *
 * DB table: execution_logs
 */
@Entity
@Table(name = "execution_logs")
public class ExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "trace_id", nullable = false, unique = true)
    private String traceId;

    @Column(name = "input_text", nullable = false, columnDefinition = "TEXT")
    private String inputText;

    // [{skillId, score}] for the winning candidate; empty when nothing matched.
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "matched_skills", columnDefinition = "json")
    private List<Map<String, Object>> matchedSkills = new ArrayList<>();

    @Column(name = "executed_skill_id")
    private String executedSkillId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_trace", columnDefinition = "json")
    private Map<String, Object> executionTrace;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_result", columnDefinition = "json")
    private Map<String, Object> outputResult;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.SUCCESS;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ExecutionLog() {}   // required by JPA

    public ExecutionLog(String traceId, String inputText) {
        this.traceId   = traceId;
        this.inputText = inputText;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                      getId()              { return id; }
    public String                    getTraceId()         { return traceId; }
    public String                    getInputText()       { return inputText; }
    public List<Map<String, Object>> getMatchedSkills()   { return matchedSkills; }
    public String                    getExecutedSkillId() { return executedSkillId; }
    public Map<String, Object>       getExecutionTrace()  { return executionTrace; }
    public Map<String, Object>       getOutputResult()    { return outputResult; }
    public Double                    getConfidenceScore() { return confidenceScore; }
    public Long                      getExecutionTimeMs() { return executionTimeMs; }
    public ExecutionStatus           getStatus()          { return status; }
    public String                    getErrorMessage()    { return errorMessage; }
    public Instant                   getCreatedAt()       { return createdAt; }

    public void setMatchedSkills(List<Map<String, Object>> v) { this.matchedSkills = v; }
    public void setExecutedSkillId(String v)                  { this.executedSkillId = v; }
    public void setExecutionTrace(Map<String, Object> v)      { this.executionTrace = v; }
    public void setOutputResult(Map<String, Object> v)        { this.outputResult = v; }
    public void setConfidenceScore(Double v)                  { this.confidenceScore = v; }
    public void setExecutionTimeMs(Long v)                    { this.executionTimeMs = v; }
    public void setStatus(ExecutionStatus v)                  { this.status = v; }
    public void setErrorMessage(String v)                     { this.errorMessage = v; }
}
