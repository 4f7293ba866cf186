package com.gbskill.engine.service;

import com.gbskill.engine.model.ExecutionLog;
import com.gbskill.engine.repository.ExecutionLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ExecutionLogService {

    private final ExecutionLogRepository repository;

    public ExecutionLogService(ExecutionLogRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public ExecutionLog getByTraceId(String traceId) {
        return repository.findByTraceId(traceId)
                .orElseThrow(() -> new ResourceNotFoundException("ExecutionLog", traceId));
    }
}
