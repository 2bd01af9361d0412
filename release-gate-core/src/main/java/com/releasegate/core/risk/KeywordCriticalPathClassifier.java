package com.releasegate.core.risk;

import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileAnalysis;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Flags components whose name contains a critical keyword.
 *
 * <p>Each matching component adds {@value #POINTS_PER_COMPONENT}. A file whose path matches
 * but whose components do not still gets one component's worth.
 */
public class KeywordCriticalPathClassifier implements CriticalPathClassifier {

    static final double POINTS_PER_COMPONENT = 5.0;

    private final List<String> keywords;

    public KeywordCriticalPathClassifier(Collection<String> keywords) {
        this.keywords = keywords.stream()
            .filter(k -> k != null && !k.isBlank())
            .map(k -> k.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
    }

    @Override
    public double classify(FileAnalysis analysis) {
        long matches = analysis.facts().components().stream()
            .map(ComponentRecord::name)
            .filter(this::matches)
            .count();
        if (matches == 0 && matches(analysis.file().path())) {
            matches = 1;
        }
        return matches * POINTS_PER_COMPONENT;
    }

    private boolean matches(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
