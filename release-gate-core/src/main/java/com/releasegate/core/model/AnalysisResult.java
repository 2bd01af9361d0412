package com.releasegate.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Terminal result of an analysis run.
 *
 * <p>A plain value: no live handles, safe to serialize with Jackson and hand to
 * report or enrichment collaborators.
 *
 * @param repositoryRoot repository root supplied by ingestion, for provenance
 * @param timestamp ISO-8601 instant the run finished
 * @param complete false when a deadline cut the per-file stage short
 * @param totalFiles number of files with a risk detail
 * @param gateCounts PASS/WARN/BLOCK counts over {@code fileDetails}
 * @param languages number of input files per language label
 * @param components first components across the batch (capped)
 * @param totalComponents true component count
 * @param dependencies merged dependency identifiers (capped)
 * @param complexity complexity summary over files with a sample
 * @param security security signal used for the run
 * @param changes change signal used for the run
 * @param riskFindings prioritized repository findings
 * @param riskScore repository risk score (0-10)
 * @param riskLevel repository risk level
 * @param fileDetails per-file risk details in input order
 * @param skippedFiles paths of files that failed or did not finish
 * @param aiInsights optional enrichment
 */
public record AnalysisResult(
    String repositoryRoot,
    String timestamp,
    boolean complete,
    int totalFiles,
    GateCounts gateCounts,
    Map<String, Integer> languages,
    List<ComponentRecord> components,
    int totalComponents,
    List<String> dependencies,
    ComplexitySummary complexity,
    SecuritySignal security,
    ChangeSignal changes,
    List<RiskFinding> riskFindings,
    double riskScore,
    RiskLevel riskLevel,
    List<FileRiskDetail> fileDetails,
    List<String> skippedFiles,
    AiInsights aiInsights
) {
    public AnalysisResult {
        Objects.requireNonNull(gateCounts, "gateCounts must not be null");
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
        languages = languages == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(languages));
        components = components == null ? List.of() : List.copyOf(components);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        complexity = complexity != null ? complexity : ComplexitySummary.empty();
        security = security != null ? security : SecuritySignal.none();
        changes = changes != null ? changes : ChangeSignal.none();
        riskFindings = riskFindings == null ? List.of() : List.copyOf(riskFindings);
        fileDetails = fileDetails == null ? List.of() : List.copyOf(fileDetails);
        skippedFiles = skippedFiles == null ? List.of() : List.copyOf(skippedFiles);
        aiInsights = aiInsights != null ? aiInsights : AiInsights.disabled();
    }

    /**
     * Returns a copy of this result with the given insights.
     *
     * @param insights enrichment output
     * @return result with {@code aiInsights} replaced
     */
    public AnalysisResult withAiInsights(AiInsights insights) {
        return new AnalysisResult(repositoryRoot, timestamp, complete, totalFiles, gateCounts, languages,
            components, totalComponents, dependencies, complexity, security, changes, riskFindings,
            riskScore, riskLevel, fileDetails, skippedFiles, insights);
    }

    /**
     * Returns true if any file was blocked.
     *
     * @return true when at least one BLOCK decision exists
     */
    public boolean hasBlockedFiles() {
        return gateCounts.blocked() > 0;
    }

    /**
     * Returns the overall gate: the worst per-file decision. Files that were never scored
     * cannot pass, so an incomplete run or one with skipped files is at least WARN.
     *
     * @return BLOCK if any file blocked, WARN if any warned or any file went unscored, PASS otherwise
     */
    public GateDecision overallGate() {
        if (gateCounts.blocked() > 0) {
            return GateDecision.BLOCK;
        }
        if (gateCounts.warned() > 0 || !complete || !skippedFiles.isEmpty()) {
            return GateDecision.WARN;
        }
        return GateDecision.PASS;
    }
}
