package com.releasegate.core.model;

/**
 * Priority of a repository-level risk finding. Declaration order is display order.
 */
public enum RiskPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
