package com.gbskill.engine.model;

public enum DatasetSourceType {
    SEED,
    GENERATED,
    MIXED
}
