package com.releasegate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Repository-level risk assessment.
 *
 * @param score risk score on the 0-10 scale, rounded to two decimals
 * @param level risk level derived from the score
 * @param findings findings sorted by priority, discovery order kept on ties
 */
public record RiskAssessment(
    double score,
    RiskLevel level,
    List<RiskFinding> findings
) {
    public RiskAssessment {
        Objects.requireNonNull(level, "level must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
