package com.releasegate.core.model;

import java.util.List;

/**
 * Structural facts a language handler extracts from one file.
 *
 * <p>A complexity of {@code 0} means "no sample": the file could not be parsed or was
 * analyzed by the fallback extractor. Any parsed file has a complexity of at least 1.
 *
 * @param components discovered components in source order
 * @param dependencies de-duplicated import/include identifiers in source order
 * @param complexity cyclomatic complexity estimate, 0 when unavailable
 */
public record StructuralFacts(
    List<ComponentRecord> components,
    List<String> dependencies,
    double complexity
) {
    private static final StructuralFacts UNPARSED = new StructuralFacts(List.of(), List.of(), 0);

    public StructuralFacts {
        components = components == null ? List.of() : List.copyOf(components);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (complexity < 0 || Double.isNaN(complexity)) {
            complexity = 0;
        }
    }

    /**
     * Facts for a file whose content could not be parsed.
     *
     * @return empty facts with complexity 0
     */
    public static StructuralFacts unparsed() {
        return UNPARSED;
    }

    /**
     * Returns true if this file produced a complexity sample.
     *
     * @return true when complexity is greater than zero
     */
    public boolean hasComplexitySample() {
        return complexity > 0;
    }
}
