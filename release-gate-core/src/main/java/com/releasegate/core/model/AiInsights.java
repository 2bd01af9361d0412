package com.releasegate.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Free-text commentary added by the optional enrichment collaborator.
 *
 * <p>Never influences scores or gate decisions.
 *
 * @param status whether insights are available
 * @param message status message (reason when disabled or unavailable)
 * @param sections commentary keyed by section (e.g., "code_quality")
 */
public record AiInsights(
    Status status,
    String message,
    Map<String, String> sections
) {
    public enum Status {
        DISABLED,
        UNAVAILABLE,
        AVAILABLE
    }

    public AiInsights {
        Objects.requireNonNull(status, "status must not be null");
        sections = sections == null ? Map.of() : Map.copyOf(sections);
    }

    public static AiInsights disabled() {
        return new AiInsights(Status.DISABLED, "AI enrichment disabled", Map.of());
    }

    public static AiInsights unavailable(String reason) {
        return new AiInsights(Status.UNAVAILABLE, reason, Map.of());
    }

    public static AiInsights available(Map<String, String> sections) {
        return new AiInsights(Status.AVAILABLE, null, sections);
    }
}
