package com.releasegate.core.risk;

import com.releasegate.core.model.FileAnalysis;

import java.util.Collection;

/**
 * Scores how much of a file sits on a critical code path (authentication, payments, ...).
 *
 * <p>Implementations return a non-negative contribution; the {@link PerFileRiskEngine}
 * caps it at {@value PerFileRiskEngine#CRITICAL_FUNCTION_CAP}.
 */
@FunctionalInterface
public interface CriticalPathClassifier {

    /**
     * Returns the critical-function contribution for a file.
     *
     * @param analysis analyzed file
     * @return contribution, 0 when the file touches no critical path
     */
    double classify(FileAnalysis analysis);

    /**
     * Classifier that never flags anything.
     *
     * @return classifier returning 0
     */
    static CriticalPathClassifier none() {
        return analysis -> 0.0;
    }

    /**
     * Classifier matching component names and the file path against keywords.
     *
     * @param keywords case-insensitive keywords
     * @return keyword classifier, or {@link #none()} when no keywords are given
     */
    static CriticalPathClassifier keywords(Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return none();
        }
        return new KeywordCriticalPathClassifier(keywords);
    }
}
