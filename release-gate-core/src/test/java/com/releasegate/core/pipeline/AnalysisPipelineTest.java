package com.releasegate.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.releasegate.core.analysis.CodeAnalyzer;
import com.releasegate.core.config.ReleaseGateConfig;
import com.releasegate.core.language.LanguageHandler;
import com.releasegate.core.language.LanguageRegistry;
import com.releasegate.core.model.AiInsights;
import com.releasegate.core.model.AnalysisMode;
import com.releasegate.core.model.AnalysisResult;
import com.releasegate.core.model.ChangeSignal;
import com.releasegate.core.model.CodeAnalysis;
import com.releasegate.core.model.ComponentRecord;
import com.releasegate.core.model.FileAnalysis;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.FileRiskDetail;
import com.releasegate.core.model.GateCounts;
import com.releasegate.core.model.GateDecision;
import com.releasegate.core.model.RiskLevel;
import com.releasegate.core.model.SecretLocation;
import com.releasegate.core.model.SecuritySignal;
import com.releasegate.core.model.Severity;
import com.releasegate.core.model.StructuralFacts;
import com.releasegate.core.model.Vulnerability;
import com.releasegate.core.risk.PerFileRiskEngine;
import com.releasegate.core.risk.RiskAssessor;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnalysisPipeline}.
 */
class AnalysisPipelineTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private static final List<FileRecord> FILES = List.of(
        FileRecord.of("src/app.py", "Python", """
            import os

            def check(x):
                if x:
                    return 1
                return 0
            """),
        FileRecord.of("src/Main.java", "Java", """
            import java.util.List;

            public class Main {
                int size(List<String> items) {
                    return items == null ? 0 : items.size();
                }
            }
            """),
        FileRecord.of("scripts/run.rb", "Ruby", "def run\n  puts 'hi'\nend\n")
    );

    @Test
    void run_mixedBatch_producesTerminalResult() {
        // Given
        AnalysisPipeline pipeline = pipeline(LanguageRegistry.withDefaults(), 2);

        // When
        AnalysisResult result = pipeline.run(AnalysisRequest.of("/repo", FILES));

        // Then
        assertThat(result.complete()).isTrue();
        assertThat(result.repositoryRoot()).isEqualTo("/repo");
        assertThat(result.timestamp()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(result.totalFiles()).isEqualTo(3);
        assertThat(result.gateCounts()).isEqualTo(new GateCounts(3, 0, 0));
        assertThat(result.languages()).containsExactly(
            Map.entry("Java", 1), Map.entry("Python", 1), Map.entry("Ruby", 1));
        assertThat(result.components()).extracting(ComponentRecord::name)
            .containsExactly("check", "Main", "size", "run");
        assertThat(result.dependencies()).containsExactly("java.util.List", "os");
        assertThat(result.complexity().samples()).isEqualTo(2);
        assertThat(result.complexity().max()).isEqualTo(2.0);
        assertThat(result.fileDetails()).extracting(FileRiskDetail::path)
            .containsExactly("src/app.py", "src/Main.java", "scripts/run.rb");
        assertThat(result.fileDetails().get(2).mode()).isEqualTo(AnalysisMode.FALLBACK);
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.skippedFiles()).isEmpty();
        assertThat(result.aiInsights().status()).isEqualTo(AiInsights.Status.DISABLED);
        assertThat(result.overallGate()).isEqualTo(GateDecision.PASS);
    }

    @Test
    void run_sameInputTwice_isIdempotent() {
        AnalysisPipeline pipeline = pipeline(LanguageRegistry.withDefaults(), 4);
        AnalysisRequest request = new AnalysisRequest("/repo", FILES, security(), ChangeSignal.none(), null);

        AnalysisResult first = pipeline.run(request);
        AnalysisResult second = pipeline.run(request);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void run_resultDoesNotDependOnConcurrency() {
        AnalysisRequest request = new AnalysisRequest("/repo", FILES, security(), ChangeSignal.none(), null);

        AnalysisResult sequential = pipeline(LanguageRegistry.withDefaults(), 1).run(request);
        AnalysisResult parallel = pipeline(LanguageRegistry.withDefaults(), 8).run(request);

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void run_securitySignal_reachesFileAndRepositoryScores() {
        AnalysisResult result = pipeline(LanguageRegistry.withDefaults(), 2)
            .run(new AnalysisRequest("/repo", FILES, security(), null, null));

        FileRiskDetail app = result.fileDetails().get(0);
        assertThat(app.issues()).hasSize(2);
        assertThat(app.breakdown().issueSeverity()).isEqualTo(30.0);
        assertThat(app.gateDecision()).isEqualTo(GateDecision.WARN);
        assertThat(result.riskScore()).isEqualTo(5.5);
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(result.overallGate()).isEqualTo(GateDecision.WARN);
    }

    @Test
    void run_emptyBatch_failsAtInputStage() {
        AnalysisPipeline pipeline = pipeline(LanguageRegistry.withDefaults(), 1);

        assertThatThrownBy(() -> pipeline.run(AnalysisRequest.of("/repo", List.of())))
            .isInstanceOf(AnalysisException.class)
            .satisfies(e -> assertThat(((AnalysisException) e).getStage()).isEqualTo(AnalysisException.Stage.INPUT));
    }

    @Test
    void run_deadlineElapsed_returnsIncompleteResult() {
        // Given: a handler that never finishes within the deadline
        LanguageRegistry registry = LanguageRegistry.withDefaults();
        registry.register("Slow", new SlowHandler());
        List<FileRecord> files = List.of(
            FileRecord.of("fast.py", "Python", "x = 1\n"),
            FileRecord.of("stuck.slow", "Slow", "anything"));

        // When
        AnalysisResult result = pipeline(registry, 2)
            .run(new AnalysisRequest("/repo", files, null, null, Duration.ofMillis(300)));

        // Then
        assertThat(result.complete()).isFalse();
        assertThat(result.skippedFiles()).containsExactly("stuck.slow");
        assertThat(result.fileDetails()).extracting(FileRiskDetail::path).containsExactly("fast.py");
        assertThat(result.totalFiles()).isEqualTo(1);
        assertThat(result.languages()).containsEntry("Slow", 1);
        assertThat(result.overallGate()).isEqualTo(GateDecision.WARN);
    }

    @Test
    void run_everyFileTimesOut_neverGatesPass() {
        // Given: nothing finishes before the deadline
        LanguageRegistry registry = LanguageRegistry.withDefaults();
        registry.register("Slow", new SlowHandler());
        List<FileRecord> files = List.of(FileRecord.of("huge.slow", "Slow", "anything"));

        // When
        AnalysisResult result = pipeline(registry, 1)
            .run(new AnalysisRequest("/repo", files, null, null, Duration.ofMillis(200)));

        // Then: no file was scored, so the run cannot read as a clean pass
        assertThat(result.complete()).isFalse();
        assertThat(result.totalFiles()).isZero();
        assertThat(result.skippedFiles()).containsExactly("huge.slow");
        assertThat(result.overallGate()).isNotEqualTo(GateDecision.PASS);
    }

    @Test
    void run_perFileScoringFailure_skipsOnlyThatFile() {
        PerFileRiskEngine failingEngine = new PerFileRiskEngine() {
            @Override
            public FileRiskDetail assess(FileAnalysis analysis, SecuritySignal security, ChangeSignal changes) {
                if (analysis.file().path().endsWith(".java")) {
                    throw new IllegalStateException("scoring bug");
                }
                return super.assess(analysis, security, changes);
            }
        };
        AnalysisPipeline pipeline = new AnalysisPipeline(
            new CodeAnalyzer(LanguageRegistry.withDefaults()), failingEngine, new RiskAssessor(), 2, FIXED_CLOCK);

        AnalysisResult result = pipeline.run(AnalysisRequest.of("/repo", FILES));

        assertThat(result.complete()).isTrue();
        assertThat(result.skippedFiles()).containsExactly("src/Main.java");
        assertThat(result.fileDetails()).hasSize(2);
        assertThat(result.dependencies()).containsExactly("os");
        assertThat(result.overallGate()).isEqualTo(GateDecision.WARN);
    }

    @Test
    void run_aggregationFailure_isRaisedWithStage() {
        CodeAnalyzer brokenAnalyzer = new CodeAnalyzer(LanguageRegistry.withDefaults()) {
            @Override
            public CodeAnalysis aggregate(List<FileAnalysis> analyses) {
                throw new IllegalStateException("aggregation bug");
            }
        };
        AnalysisPipeline pipeline = new AnalysisPipeline(
            brokenAnalyzer, new PerFileRiskEngine(), new RiskAssessor(), 1, FIXED_CLOCK);

        assertThatThrownBy(() -> pipeline.run(AnalysisRequest.of("/repo", FILES)))
            .isInstanceOf(AnalysisException.class)
            .hasMessage("aggregation bug")
            .satisfies(e -> assertThat(((AnalysisException) e).getStage())
                .isEqualTo(AnalysisException.Stage.AGGREGATION));
    }

    @Test
    void run_enricherFailure_degradesToUnavailable() {
        InsightEnricher failing = result -> {
            throw new IllegalStateException("rate limited");
        };
        AnalysisPipeline pipeline = new AnalysisPipeline(
            new CodeAnalyzer(LanguageRegistry.withDefaults()), new PerFileRiskEngine(), new RiskAssessor(),
            1, FIXED_CLOCK, failing, true);

        AnalysisResult result = pipeline.run(new AnalysisRequest("/repo", FILES, security(), null, null));

        assertThat(result.aiInsights().status()).isEqualTo(AiInsights.Status.UNAVAILABLE);
        assertThat(result.aiInsights().message()).isEqualTo("rate limited");
        assertThat(result.riskScore()).isEqualTo(5.5);
    }

    @Test
    void run_enricherOutput_isAttachedWithoutChangingScores() {
        InsightEnricher enricher = result -> AiInsights.available(Map.of("summary", "Looks fine"));
        AnalysisPipeline withEnricher = new AnalysisPipeline(
            new CodeAnalyzer(LanguageRegistry.withDefaults()), new PerFileRiskEngine(), new RiskAssessor(),
            1, FIXED_CLOCK, enricher, true);

        AnalysisResult enriched = withEnricher.run(AnalysisRequest.of("/repo", FILES));
        AnalysisResult plain = pipeline(LanguageRegistry.withDefaults(), 1).run(AnalysisRequest.of("/repo", FILES));

        assertThat(enriched.aiInsights().sections()).containsEntry("summary", "Looks fine");
        assertThat(enriched.withAiInsights(AiInsights.disabled())).isEqualTo(plain);
    }

    @Test
    void run_enrichmentEnabledWithoutEnricher_isUnavailable() {
        AnalysisPipeline pipeline = new AnalysisPipeline(
            new CodeAnalyzer(LanguageRegistry.withDefaults()), new PerFileRiskEngine(), new RiskAssessor(),
            1, FIXED_CLOCK, null, true);

        AnalysisResult result = pipeline.run(AnalysisRequest.of("/repo", FILES));

        assertThat(result.aiInsights().status()).isEqualTo(AiInsights.Status.UNAVAILABLE);
    }

    @Test
    void fromConfig_disabledLanguage_fallsBackToGenericAnalysis() {
        ReleaseGateConfig config = new ReleaseGateConfig(null,
            new ReleaseGateConfig.AnalysisSettings(2, null, null),
            new ReleaseGateConfig.LanguageSettings(List.of("Java")),
            new ReleaseGateConfig.RiskSettings(List.of("check")),
            null, null);

        AnalysisResult result = AnalysisPipeline.fromConfig(config, LanguageRegistry.withDefaults())
            .run(AnalysisRequest.of("/repo", FILES));

        assertThat(result.fileDetails().get(1).mode()).isEqualTo(AnalysisMode.FALLBACK);
        assertThat(result.fileDetails().get(0).breakdown().criticalFunction()).isEqualTo(5.0);
    }

    @Test
    void constructor_nonPositiveConcurrency_isRejected() {
        assertThatThrownBy(() -> pipeline(LanguageRegistry.withDefaults(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void result_serializesToJson() throws Exception {
        AnalysisResult result = pipeline(LanguageRegistry.withDefaults(), 2)
            .run(new AnalysisRequest("/repo", FILES, security(), null, null));

        JsonNode json = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(result));

        assertThat(json.get("riskLevel").asText()).isEqualTo("MEDIUM");
        assertThat(json.get("gateCounts").get("warned").asInt()).isEqualTo(1);
        assertThat(json.get("fileDetails")).hasSize(3);
        assertThat(json.get("fileDetails").get(0).get("gateDecision").asText()).isEqualTo("WARN");
        assertThat(json.get("aiInsights").get("status").asText()).isEqualTo("DISABLED");
    }

    private static AnalysisPipeline pipeline(LanguageRegistry registry, int concurrency) {
        return new AnalysisPipeline(
            new CodeAnalyzer(registry), new PerFileRiskEngine(), new RiskAssessor(), concurrency, FIXED_CLOCK);
    }

    private static SecuritySignal security() {
        return new SecuritySignal(
            List.of(new Vulnerability(Severity.CRITICAL, "src/app.py", 5, "Command injection", null)),
            List.of(new SecretLocation("app.py", 2)));
    }

    private static final class SlowHandler implements LanguageHandler {

        @Override
        public String getId() {
            return "slow";
        }

        @Override
        public String getDisplayName() {
            return "Slow";
        }

        @Override
        public Set<String> getLanguages() {
            return Set.of("Slow");
        }

        @Override
        public StructuralFacts analyze(FileRecord file) {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StructuralFacts.unparsed();
        }

        @Override
        public List<ComponentRecord> extractComponents(String content) {
            return List.of();
        }

        @Override
        public List<String> extractDependencies(String content) {
            return List.of();
        }
    }
}
