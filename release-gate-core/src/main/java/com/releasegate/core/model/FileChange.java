package com.releasegate.core.model;

import java.util.Objects;

/**
 * A changed file reported by the change-detection collaborator.
 *
 * @param path file path relative to the repository root
 * @param type change type
 * @param linesAdded lines added, 0 when unknown
 * @param linesDeleted lines deleted, 0 when unknown
 */
public record FileChange(
    String path,
    ChangeType type,
    int linesAdded,
    int linesDeleted
) {
    public FileChange {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(type, "type must not be null");
        linesAdded = Math.max(linesAdded, 0);
        linesDeleted = Math.max(linesDeleted, 0);
    }
}
