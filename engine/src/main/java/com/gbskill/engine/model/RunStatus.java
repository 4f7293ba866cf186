package com.gbskill.engine.model;

/**
 * States of a benchmark run.
 *
 *   PENDING → RUNNING → COMPLETED
 *                     ↘ FAILED
 *
 * COMPLETED and FAILED are terminal.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
