package com.gbskill.engine.model;

/** ARCHIVED datasets keep their cases but cannot be run. */
public enum DatasetStatus {
    DRAFT,
    READY,
    ARCHIVED
}
