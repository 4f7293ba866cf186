package com.gbskill.engine.benchmark;

/**
 * A benchmark operation refused because its preconditions do not hold.
 *
 * Case-level failures never surface as this exception; they are recorded as
 * ERROR results.
 */
public class BenchmarkException extends RuntimeException {

    public enum Kind {
        RUN_ALREADY_IN_PROGRESS,
        RUN_FAILED,
        RUN_NOT_COMPLETED,
        DATASET_EMPTY,
        DATASET_ARCHIVED,
        TEMPLATE_INACTIVE
    }

    private final Kind kind;

    public BenchmarkException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
