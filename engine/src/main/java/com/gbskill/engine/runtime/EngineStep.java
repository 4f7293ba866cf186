package com.gbskill.engine.runtime;

import java.time.Instant;
import java.util.Map;

/**
 * Timing and input/output snapshot of one engine stage.
 *
 * @param status "success" or "error"
 */
public record EngineStep(
        String              engine,
        Instant             startTime,
        Instant             endTime,
        long                durationMs,
        Map<String, Object> inputData,
        Map<String, Object> outputData,
        String              status,
        String              message) {}
