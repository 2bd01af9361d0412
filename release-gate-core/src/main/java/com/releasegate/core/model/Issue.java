package com.releasegate.core.model;

import java.util.Objects;

/**
 * A problem detected in a single file.
 *
 * @param line line number, 0 when unknown
 * @param description human-readable description
 * @param severity issue severity
 */
public record Issue(
    int line,
    String description,
    Severity severity
) {
    public Issue {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }
}
