package com.releasegate.core.model;

import java.util.Objects;

/**
 * A function, method, class, struct or UI component found by a language handler.
 *
 * @param name component name
 * @param kind component kind
 * @param lines line span of the component, 0 when unknown
 */
public record ComponentRecord(
    String name,
    ComponentKind kind,
    int lines
) {
    public ComponentRecord {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (lines < 0) {
            lines = 0;
        }
    }

    public static ComponentRecord of(String name, ComponentKind kind) {
        return new ComponentRecord(name, kind, 0);
    }
}
