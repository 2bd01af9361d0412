package com.releasegate.core.pipeline;

import com.releasegate.core.model.AiInsights;
import com.releasegate.core.model.AnalysisResult;

/**
 * Optional collaborator that adds free-text commentary to a finished result.
 *
 * <p>Runs after scoring and never influences scores or gate decisions. Exceptions thrown by
 * an enricher degrade to {@link AiInsights#unavailable(String)}.
 */
@FunctionalInterface
public interface InsightEnricher {

    AiInsights enrich(AnalysisResult result);
}
