package com.releasegate.core.model;

/**
 * Severity of a vulnerability or file issue reported by the security collaborator.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
