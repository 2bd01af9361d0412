package com.releasegate.core.model;

import java.util.Objects;

/**
 * A prioritized, human-readable repository risk item.
 *
 * @param priority finding priority
 * @param title short title
 * @param description what was found
 * @param mitigation what to do about it
 */
public record RiskFinding(
    RiskPriority priority,
    String title,
    String description,
    String mitigation
) {
    public RiskFinding {
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(title, "title must not be null");
        description = description != null ? description : "";
        mitigation = mitigation != null ? mitigation : "";
    }
}
