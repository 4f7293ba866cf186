package com.gbskill.engine.model;

/** Where a benchmark case came from. */
public enum CaseSourceType {
    SEED,
    TABLE_ENUM,
    TEMPLATE,
    NOISE
}
