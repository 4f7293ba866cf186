package com.gbskill.engine.repository;

import com.gbskill.engine.model.BenchmarkDataset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface BenchmarkDatasetRepository extends JpaRepository<BenchmarkDataset, UUID> {

    boolean existsByDatasetCode(String datasetCode);
}
