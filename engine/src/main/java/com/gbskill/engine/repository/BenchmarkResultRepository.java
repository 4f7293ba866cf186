package com.gbskill.engine.repository;

import com.gbskill.engine.model.BenchmarkResult;
import com.gbskill.engine.model.ResultStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store of per-case results.
 */
public interface BenchmarkResultRepository extends JpaRepository<BenchmarkResult, UUID> {

    /** Results with their case, in evaluation order. Used for metrics and failure listings. */
    @Query("""
            SELECT r FROM BenchmarkResult r
            JOIN FETCH r.benchmarkCase c
            WHERE r.run.id = :runId
            ORDER BY r.createdAt ASC
            """)
    List<BenchmarkResult> findWithCaseByRunId(@Param("runId") UUID runId);

    @Query("""
            SELECT r FROM BenchmarkResult r
            JOIN FETCH r.benchmarkCase c
            WHERE r.run.id = :runId AND r.status IN :statuses
            ORDER BY r.createdAt ASC
            """)
    List<BenchmarkResult> findWithCaseByRunIdAndStatusIn(@Param("runId") UUID runId,
                                                         @Param("statuses") Collection<ResultStatus> statuses);

    long countByRunId(UUID runId);
}
