package com.gbskill.engine.model;

import com.gbskill.engine.benchmark.evaluation.BenchmarkMetrics;
import com.gbskill.engine.benchmark.evaluation.EvaluationConfig;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One evaluation of every active case of a dataset.
 *
 * Only the counters and status advance while the run executes; results are
 * separate append-only rows. {@code metrics} is written once, on completion.
 *
 * DB table: benchmark_runs
 */
@Entity
@Table(name = "benchmark_runs")
public class BenchmarkRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_code", nullable = false, unique = true)
    private String runCode;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "dataset_id", nullable = false)
    private BenchmarkDataset dataset;

    @Column(name = "run_name")
    private String runName;

    @Column(columnDefinition = "TEXT")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "json")
    private EvaluationConfig config = EvaluationConfig.defaults();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "total_cases", nullable = false)
    private int totalCases = 0;

    @Column(name = "completed_cases", nullable = false)
    private int completedCases = 0;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "json")
    private BenchmarkMetrics metrics;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected BenchmarkRun() {}   // required by JPA

    public BenchmarkRun(String runCode, BenchmarkDataset dataset, EvaluationConfig config) {
        this.runCode = runCode;
        this.dataset = dataset;
        this.config  = config;
    }

    /** Percentage of cases evaluated so far, 0 when the run has no cases. */
    public double getProgress() {
        if (totalCases == 0) return 0.0;
        return Math.round(completedCases * 10000.0 / totalCases) / 100.0;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID             getId()             { return id; }
    public String           getRunCode()        { return runCode; }
    public BenchmarkDataset getDataset()        { return dataset; }
    public String           getRunName()        { return runName; }
    public String           getDescription()    { return description; }
    public EvaluationConfig getConfig()         { return config; }
    public RunStatus        getStatus()         { return status; }
    public Instant          getStartedAt()      { return startedAt; }
    public Instant          getCompletedAt()    { return completedAt; }
    public int              getTotalCases()     { return totalCases; }
    public int              getCompletedCases() { return completedCases; }
    public BenchmarkMetrics getMetrics()        { return metrics; }
    public String           getErrorMessage()   { return errorMessage; }
    public Instant          getCreatedAt()      { return createdAt; }
    public Instant          getUpdatedAt()      { return updatedAt; }

    public void setRunName(String v)            { this.runName = v; }
    public void setDescription(String v)        { this.description = v; }
    public void setStatus(RunStatus v)          { this.status = v; }
    public void setStartedAt(Instant v)         { this.startedAt = v; }
    public void setCompletedAt(Instant v)       { this.completedAt = v; }
    public void setTotalCases(int v)            { this.totalCases = v; }
    public void setCompletedCases(int v)        { this.completedCases = v; }
    public void setMetrics(BenchmarkMetrics v)  { this.metrics = v; }
    public void setErrorMessage(String v)       { this.errorMessage = v; }
}
