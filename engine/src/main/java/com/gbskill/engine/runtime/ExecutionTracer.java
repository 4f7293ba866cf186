package com.gbskill.engine.runtime;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Collects the stages of a single pipeline execution.
 *
 * Each call to {@link #trace} times one stage, records its input and output
 * snapshots and feeds the {@code skillengine.engine.duration{engine}} timer.
 * One tracer belongs to one execution and is not shared between threads.
 */
public class ExecutionTracer {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracer.class);

    static final String TIMER = "skillengine.engine.duration";

    private final String traceId;
    private final MeterRegistry meterRegistry;
    private final List<EngineStep> steps = new ArrayList<>();

    public ExecutionTracer(String traceId, MeterRegistry meterRegistry) {
        this.traceId = traceId;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run one stage under the tracer.
     *
     * A stage that throws is recorded with status "error" and the exception
     * propagates unchanged.
     */
    public <T> T trace(String engine, Map<String, Object> input,
                       Supplier<T> stage, Function<? super T, Map<String, Object>> output) {
        Instant start = Instant.now();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = stage.get();
            Instant end = Instant.now();
            Map<String, Object> snapshot = output.apply(result);
            steps.add(new EngineStep(engine, start, end, millisBetween(start, end),
                    input, snapshot, "success", null));
            log.debug("{} finished in {} ms: {}", engine, millisBetween(start, end), snapshot);
            return result;
        } catch (RuntimeException e) {
            Instant end = Instant.now();
            steps.add(new EngineStep(engine, start, end, millisBetween(start, end),
                    input, null, "error", e.getMessage()));
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(TIMER, "engine", engine));
        }
    }

    public String traceId() {
        return traceId;
    }

    public List<EngineStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    public ExecutionTrace finish(long totalDurationMs) {
        return new ExecutionTrace(traceId, List.copyOf(steps), totalDurationMs);
    }

    /** Ordered snapshot map from alternating keys and values; values may be null. */
    public static Map<String, Object> snapshot(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("snapshot needs key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return map;
    }

    private static long millisBetween(Instant a, Instant b) {
        return b.toEpochMilli() - a.toEpochMilli();
    }
}
