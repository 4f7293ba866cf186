package com.gbskill.engine.model;

/**
 * Verdict on one evaluated case.
 *
 * SUCCESS ≥ 0.9 overall score, PARTIAL ≥ 0.5, FAILED below that or when the
 * expected skill was not matched. ERROR means the pipeline threw.
 */
public enum ResultStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    ERROR
}
