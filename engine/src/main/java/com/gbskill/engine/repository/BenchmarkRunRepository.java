package com.gbskill.engine.repository;

import com.gbskill.engine.model.BenchmarkRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BenchmarkRunRepository extends JpaRepository<BenchmarkRun, UUID> {

    List<BenchmarkRun> findByDatasetIdOrderByCreatedAtDesc(UUID datasetId);
}
