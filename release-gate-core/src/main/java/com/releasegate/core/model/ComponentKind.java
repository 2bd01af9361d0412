package com.releasegate.core.model;

/**
 * Kind of structural unit discovered in a source file.
 */
public enum ComponentKind {
    FUNCTION,
    METHOD,
    CLASS,
    STRUCT,
    /**
     * UI component (e.g., a React component).
     */
    COMPONENT
}
