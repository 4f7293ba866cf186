package com.gbskill.engine.model;

/** Outcome of one pipeline execution. */
public enum ExecutionStatus {
    SUCCESS,
    FAILED
}
