package com.releasegate.core.model;

/**
 * Release gate verdict for a single file, a pure function of its 0-100 risk score.
 */
public enum GateDecision {
    PASS,
    WARN,
    BLOCK;

    /** Scores at or above this value are at least {@link #WARN}. */
    public static final double WARN_THRESHOLD = 30.0;

    /** Scores at or above this value are {@link #BLOCK}. */
    public static final double BLOCK_THRESHOLD = 60.0;

    /**
     * Maps a file risk score to a gate decision.
     *
     * @param score risk score on the 0-100 scale
     * @return PASS below 30, WARN from 30 to below 60, BLOCK from 60
     */
    public static GateDecision forScore(double score) {
        if (score >= BLOCK_THRESHOLD) {
            return BLOCK;
        }
        if (score >= WARN_THRESHOLD) {
            return WARN;
        }
        return PASS;
    }
}
