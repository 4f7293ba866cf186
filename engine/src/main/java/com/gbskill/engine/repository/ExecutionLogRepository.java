package com.gbskill.engine.repository;

import com.gbskill.engine.model.ExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ExecutionLogRepository extends JpaRepository<ExecutionLog, UUID> {

    Optional<ExecutionLog> findByTraceId(String traceId);
}
