package com.releasegate.core.model;

/**
 * Repository risk level on the 0-10 scale.
 *
 * <p>Independent of the per-file {@link GateDecision} thresholds, which use a 0-100 scale.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static final double MEDIUM_THRESHOLD = 4.0;
    public static final double HIGH_THRESHOLD = 7.0;

    /**
     * Maps a repository risk score to a level.
     *
     * @param score score on the 0-10 scale
     * @return HIGH from 7.0, MEDIUM from 4.0, LOW otherwise
     */
    public static RiskLevel forScore(double score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
