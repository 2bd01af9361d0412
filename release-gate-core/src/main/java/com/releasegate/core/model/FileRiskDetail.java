package com.releasegate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-file risk report handed to reporting collaborators.
 *
 * @param name file name
 * @param path file path
 * @param language language label
 * @param lines line count
 * @param mode how the structural facts were produced
 * @param complexity cyclomatic complexity, 0 when no sample
 * @param maintainability display metric, {@code max(100 - complexity * 5, 0)}
 * @param riskScore file risk score (0-100), rounded to two decimals
 * @param gateDecision gate decision for the score
 * @param breakdown risk score decomposition
 * @param issues issues attributed to this file
 * @param changes changed line counts for this file
 * @param recommendations review recommendations
 */
public record FileRiskDetail(
    String name,
    String path,
    String language,
    int lines,
    AnalysisMode mode,
    double complexity,
    double maintainability,
    double riskScore,
    GateDecision gateDecision,
    RiskBreakdown breakdown,
    List<Issue> issues,
    FileChangeStats changes,
    List<String> recommendations
) {
    public FileRiskDetail {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(gateDecision, "gateDecision must not be null");
        Objects.requireNonNull(breakdown, "breakdown must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        changes = changes != null ? changes : FileChangeStats.none();
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
