package com.releasegate.core.model;

/**
 * Additive decomposition of a file risk score.
 *
 * <p>Each part is already capped by the risk engine; the total is capped at 100.
 *
 * @param complexity contribution of cyclomatic complexity (max 50)
 * @param changeVolume contribution of changed lines (max 25)
 * @param criticalFunction contribution of critical-path components (max 15)
 * @param issueSeverity contribution of detected issues (max 30)
 */
public record RiskBreakdown(
    double complexity,
    double changeVolume,
    double criticalFunction,
    double issueSeverity
) {
    public static final double MAX_SCORE = 100.0;

    public RiskBreakdown {
        complexity = nonNegative(complexity);
        changeVolume = nonNegative(changeVolume);
        criticalFunction = nonNegative(criticalFunction);
        issueSeverity = nonNegative(issueSeverity);
    }

    /**
     * Sum of all contributions, capped at {@value #MAX_SCORE}.
     *
     * @return file risk score
     */
    public double total() {
        return Math.min(complexity + changeVolume + criticalFunction + issueSeverity, MAX_SCORE);
    }

    private static double nonNegative(double value) {
        return Double.isNaN(value) || value < 0 ? 0.0 : value;
    }
}
