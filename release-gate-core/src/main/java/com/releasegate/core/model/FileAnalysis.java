package com.releasegate.core.model;

import java.util.Objects;

/**
 * Per-file output of the code analyzer.
 *
 * @param file analyzed file
 * @param facts extracted structural facts
 * @param mode how the facts were produced
 */
public record FileAnalysis(
    FileRecord file,
    StructuralFacts facts,
    AnalysisMode mode
) {
    public FileAnalysis {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (facts == null) {
            facts = StructuralFacts.unparsed();
        }
    }
}
