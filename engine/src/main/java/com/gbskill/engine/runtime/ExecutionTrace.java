package com.gbskill.engine.runtime;

import java.util.List;

/** Ordered stage record of one pipeline execution. */
public record ExecutionTrace(String traceId, List<EngineStep> steps, long totalDurationMs) {}
