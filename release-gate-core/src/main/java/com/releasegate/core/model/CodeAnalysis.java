package com.releasegate.core.model;

import java.util.List;

/**
 * Aggregated structural view of a batch of files.
 *
 * @param fileAnalyses per-file results in input order
 * @param components first components across all files (capped)
 * @param totalComponents true number of components found
 * @param dependencies sorted union of dependencies (capped)
 * @param totalDependencies true number of distinct dependencies
 * @param complexity complexity summary over files with a sample
 */
public record CodeAnalysis(
    List<FileAnalysis> fileAnalyses,
    List<ComponentRecord> components,
    int totalComponents,
    List<String> dependencies,
    int totalDependencies,
    ComplexitySummary complexity
) {
    public CodeAnalysis {
        fileAnalyses = fileAnalyses == null ? List.of() : List.copyOf(fileAnalyses);
        components = components == null ? List.of() : List.copyOf(components);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (complexity == null) {
            complexity = ComplexitySummary.empty();
        }
    }
}
