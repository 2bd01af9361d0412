package com.releasegate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration for release-gate runs.
 *
 * <p>Loaded from {@code releasegate.yaml} in the repository root. Every section is optional;
 * the {@code effective*} accessors resolve missing values to defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "my-service"
 *   version: "1.0.0"
 *
 * analysis:
 *   concurrency: 4
 *   timeoutSeconds: 300
 *   maxFileSizeKb: 10240
 *
 * languages:
 *   disabled:
 *     - C
 *
 * risk:
 *   criticalKeywords: [auth, payment, password]
 *
 * ai:
 *   enabled: false
 *
 * output:
 *   format: text
 * }</pre>
 *
 * @param project project metadata
 * @param analysis analysis settings
 * @param languages language handler settings
 * @param risk risk scoring settings
 * @param ai insight enrichment settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReleaseGateConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("languages") LanguageSettings languages,
    @JsonProperty("risk") RiskSettings risk,
    @JsonProperty("ai") AiSettings ai,
    @JsonProperty("output") OutputSettings output
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_FILE_SIZE_KB = 10 * 1024;

    /**
     * Creates the default configuration: all languages enabled, no critical keywords,
     * enrichment off, text output.
     *
     * @return default configuration
     */
    public static ReleaseGateConfig defaults() {
        return new ReleaseGateConfig(
            new ProjectInfo("project", "1.0.0"),
            new AnalysisSettings(null, DEFAULT_TIMEOUT_SECONDS, DEFAULT_MAX_FILE_SIZE_KB),
            new LanguageSettings(List.of()),
            new RiskSettings(List.of()),
            new AiSettings(false),
            new OutputSettings("text", null)
        );
    }

    /**
     * Number of worker threads for the per-file stage.
     *
     * @return configured concurrency, or the number of available processors
     */
    public int effectiveConcurrency() {
        if (analysis != null && analysis.concurrency() != null && analysis.concurrency() > 0) {
            return analysis.concurrency();
        }
        return Runtime.getRuntime().availableProcessors();
    }

    public int effectiveTimeoutSeconds() {
        if (analysis != null && analysis.timeoutSeconds() != null && analysis.timeoutSeconds() > 0) {
            return analysis.timeoutSeconds();
        }
        return DEFAULT_TIMEOUT_SECONDS;
    }

    public long effectiveMaxFileSizeBytes() {
        if (analysis != null && analysis.maxFileSizeKb() != null && analysis.maxFileSizeKb() > 0) {
            return analysis.maxFileSizeKb() * 1024L;
        }
        return DEFAULT_MAX_FILE_SIZE_KB * 1024L;
    }

    public List<String> effectiveDisabledLanguages() {
        return languages != null && languages.disabled() != null ? languages.disabled() : List.of();
    }

    public List<String> effectiveCriticalKeywords() {
        return risk != null && risk.criticalKeywords() != null ? risk.criticalKeywords() : List.of();
    }

    public boolean aiEnabled() {
        return ai != null && Boolean.TRUE.equals(ai.enabled());
    }

    /**
     * Output format, lower-cased.
     *
     * @return "text" or "json"; "text" when unset
     */
    public String effectiveOutputFormat() {
        if (output == null || output.format() == null || output.format().isBlank()) {
            return "text";
        }
        return output.format().trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version
    ) {}

    /**
     * Analysis settings.
     *
     * @param concurrency worker threads for the per-file stage (null = available processors)
     * @param timeoutSeconds deadline for the per-file stage
     * @param maxFileSizeKb files larger than this are not ingested
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("concurrency") Integer concurrency,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("maxFileSizeKb") Integer maxFileSizeKb
    ) {}

    /**
     * Language handler settings.
     *
     * @param disabled language labels whose handler is unregistered (files fall back to generic analysis)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LanguageSettings(
        @JsonProperty("disabled") List<String> disabled
    ) {}

    /**
     * Risk scoring settings.
     *
     * @param criticalKeywords keywords marking critical-path components
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RiskSettings(
        @JsonProperty("criticalKeywords") List<String> criticalKeywords
    ) {}

    /**
     * Insight enrichment settings.
     *
     * @param enabled whether an insight enricher is invoked after scoring
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AiSettings(
        @JsonProperty("enabled") Boolean enabled
    ) {}

    /**
     * Output settings.
     *
     * @param format "text" or "json"
     * @param file output file, null for standard output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("format") String format,
        @JsonProperty("file") String file
    ) {}
}
