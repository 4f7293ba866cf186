package com.gbskill.engine.repository;

import com.gbskill.engine.model.BenchmarkCase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Cases are always read in a stable order (creation time, then code) so that
 * a run visits them deterministically.
 */
public interface BenchmarkCaseRepository extends JpaRepository<BenchmarkCase, UUID> {

    List<BenchmarkCase> findByDatasetIdAndActiveTrueOrderByCreatedAtAscCaseCodeAsc(UUID datasetId);

    List<BenchmarkCase> findByDatasetIdOrderByCreatedAtAscCaseCodeAsc(UUID datasetId);

    long countByDatasetIdAndActiveTrue(UUID datasetId);

    long countByDatasetId(UUID datasetId);
}
