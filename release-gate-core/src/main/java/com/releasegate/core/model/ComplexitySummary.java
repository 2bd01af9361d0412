package com.releasegate.core.model;

/**
 * Repository-level complexity figures, computed over files that produced a sample.
 *
 * @param average mean complexity rounded to two decimals, 0 with no samples
 * @param max highest complexity, 0 with no samples
 * @param samples number of files that contributed a sample
 */
public record ComplexitySummary(
    double average,
    double max,
    int samples
) {
    public static ComplexitySummary empty() {
        return new ComplexitySummary(0, 0, 0);
    }
}
