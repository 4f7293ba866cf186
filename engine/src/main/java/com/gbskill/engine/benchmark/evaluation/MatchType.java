package com.gbskill.engine.benchmark.evaluation;

/** How an actual attribute value was judged against its expectation. */
public enum MatchType {
    EXACT,
    NORMALIZED,
    TOLERANCE,
    FUZZY,
    MISMATCH,
    MISSING,
    /** Produced by the engine but not expected; recorded, never scored. */
    EXTRA
}
