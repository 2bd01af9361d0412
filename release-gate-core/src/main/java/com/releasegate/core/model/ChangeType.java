package com.releasegate.core.model;

/**
 * Type of a file change reported by change detection.
 */
public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED
}
