package com.releasegate.core.pipeline;

import com.releasegate.core.analysis.CodeAnalyzer;
import com.releasegate.core.config.ReleaseGateConfig;
import com.releasegate.core.language.LanguageRegistry;
import com.releasegate.core.model.AiInsights;
import com.releasegate.core.model.AnalysisResult;
import com.releasegate.core.model.CodeAnalysis;
import com.releasegate.core.model.FileAnalysis;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.FileRiskDetail;
import com.releasegate.core.model.GateCounts;
import com.releasegate.core.model.RiskAssessment;
import com.releasegate.core.risk.CriticalPathClassifier;
import com.releasegate.core.risk.PerFileRiskEngine;
import com.releasegate.core.risk.RiskAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates one analysis run: per-file analysis and scoring, aggregation, repository
 * risk assessment and optional enrichment.
 *
 * <p><b>Stages:</b>
 * <ol>
 *   <li>Per-file: {@link CodeAnalyzer#analyzeFile} then {@link PerFileRiskEngine#assess} for each
 *       file on a fixed pool of worker threads. A failing file is logged and listed as skipped.</li>
 *   <li>Aggregation: {@link CodeAnalyzer#aggregate} over finished files, in input order.</li>
 *   <li>Risk assessment: {@link RiskAssessor#assess}.</li>
 *   <li>Enrichment: {@link InsightEnricher}, when enabled.</li>
 * </ol>
 *
 * <p>When the request deadline elapses, unfinished per-file tasks are cancelled and the result
 * is marked incomplete. Failures of the aggregation or risk-assessment stage are fatal and
 * raised as {@link AnalysisException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisPipeline pipeline = AnalysisPipeline.fromConfig(config, LanguageRegistry.withDefaults());
 * AnalysisResult result = pipeline.run(new AnalysisRequest(root, files, security, changes, timeout));
 * }</pre>
 */
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final CodeAnalyzer codeAnalyzer;
    private final PerFileRiskEngine riskEngine;
    private final RiskAssessor riskAssessor;
    private final int concurrency;
    private final Clock clock;
    private final InsightEnricher enricher;
    private final boolean enrichmentEnabled;

    public AnalysisPipeline(CodeAnalyzer codeAnalyzer,
                            PerFileRiskEngine riskEngine,
                            RiskAssessor riskAssessor,
                            int concurrency,
                            Clock clock) {
        this(codeAnalyzer, riskEngine, riskAssessor, concurrency, clock, null, false);
    }

    public AnalysisPipeline(CodeAnalyzer codeAnalyzer,
                            PerFileRiskEngine riskEngine,
                            RiskAssessor riskAssessor,
                            int concurrency,
                            Clock clock,
                            InsightEnricher enricher,
                            boolean enrichmentEnabled) {
        this.codeAnalyzer = Objects.requireNonNull(codeAnalyzer, "codeAnalyzer must not be null");
        this.riskEngine = Objects.requireNonNull(riskEngine, "riskEngine must not be null");
        this.riskAssessor = Objects.requireNonNull(riskAssessor, "riskAssessor must not be null");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        this.concurrency = concurrency;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.enricher = enricher;
        this.enrichmentEnabled = enrichmentEnabled;
    }

    /**
     * Builds a pipeline from configuration.
     *
     * <p>Handlers for disabled languages are unregistered, critical keywords feed a keyword
     * classifier and the concurrency comes from {@code analysis.concurrency}.
     *
     * @param config configuration
     * @param registry language registry, modified in place for disabled languages
     * @return pipeline using the system clock and no enricher
     */
    public static AnalysisPipeline fromConfig(ReleaseGateConfig config, LanguageRegistry registry) {
        return fromConfig(config, registry, null);
    }

    /**
     * Builds a pipeline from configuration with an insight enricher.
     *
     * @param config configuration
     * @param registry language registry, modified in place for disabled languages
     * @param enricher enricher invoked when {@code ai.enabled} is set, may be null
     * @return pipeline using the system clock
     */
    public static AnalysisPipeline fromConfig(ReleaseGateConfig config, LanguageRegistry registry,
                                              InsightEnricher enricher) {
        config.effectiveDisabledLanguages().forEach(registry::unregister);
        return new AnalysisPipeline(
            new CodeAnalyzer(registry),
            new PerFileRiskEngine(CriticalPathClassifier.keywords(config.effectiveCriticalKeywords())),
            new RiskAssessor(),
            config.effectiveConcurrency(),
            Clock.systemUTC(),
            enricher,
            config.aiEnabled()
        );
    }

    /**
     * Runs the full analysis.
     *
     * @param request files and signals
     * @return terminal result, {@code complete = false} when the deadline cut the run short
     * @throws AnalysisException when the batch is empty or a batch-level stage fails
     */
    public AnalysisResult run(AnalysisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<FileRecord> files = request.files();
        if (files.isEmpty()) {
            throw new AnalysisException(AnalysisException.Stage.INPUT, "No files to analyze");
        }

        log.info("Starting analysis of {} files with {} workers", files.size(), concurrency);
        PerFileStage perFile = runPerFileStage(request);

        CodeAnalysis codeAnalysis;
        try {
            codeAnalysis = codeAnalyzer.aggregate(perFile.analyses());
        } catch (RuntimeException e) {
            throw new AnalysisException(AnalysisException.Stage.AGGREGATION, e.getMessage(), e);
        }

        RiskAssessment assessment;
        try {
            assessment = riskAssessor.assess(codeAnalysis.complexity(), request.security(), request.changes());
        } catch (RuntimeException e) {
            throw new AnalysisException(AnalysisException.Stage.RISK_ASSESSMENT, e.getMessage(), e);
        }

        AnalysisResult result = new AnalysisResult(
            request.repositoryRoot(),
            Instant.now(clock).toString(),
            perFile.complete(),
            perFile.details().size(),
            GateCounts.of(perFile.details()),
            countLanguages(files),
            codeAnalysis.components(),
            codeAnalysis.totalComponents(),
            codeAnalysis.dependencies(),
            codeAnalysis.complexity(),
            request.security(),
            request.changes(),
            assessment.findings(),
            assessment.score(),
            assessment.level(),
            perFile.details(),
            perFile.skipped(),
            AiInsights.disabled()
        );

        log.info("Analysis {}: {} files, gate counts {}, repository risk {} ({})",
            result.complete() ? "complete" : "incomplete",
            result.totalFiles(), result.gateCounts(), result.riskScore(), result.riskLevel());
        return result.withAiInsights(enrich(result));
    }

    private PerFileStage runPerFileStage(AnalysisRequest request) {
        List<FileRecord> files = request.files();
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(concurrency, files.size()), new WorkerThreadFactory());
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (FileRecord file : files) {
                futures.add(executor.submit(() -> processFile(file, request)));
            }
            return collect(files, futures, request);
        } finally {
            executor.shutdownNow();
        }
    }

    private FileOutcome processFile(FileRecord file, AnalysisRequest request) {
        FileAnalysis analysis = codeAnalyzer.analyzeFile(file);
        FileRiskDetail detail = riskEngine.assess(analysis, request.security(), request.changes());
        return new FileOutcome(analysis, detail);
    }

    private PerFileStage collect(List<FileRecord> files, List<Future<FileOutcome>> futures, AnalysisRequest request) {
        long deadlineNanos = request.deadline() != null
            ? System.nanoTime() + request.deadline().toNanos()
            : Long.MAX_VALUE;
        boolean timedOut = false;

        List<FileAnalysis> analyses = new ArrayList<>();
        List<FileRiskDetail> details = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            Future<FileOutcome> future = futures.get(i);
            String path = files.get(i).path();
            try {
                FileOutcome outcome;
                if (timedOut) {
                    outcome = finishedOrCancel(future);
                } else if (deadlineNanos == Long.MAX_VALUE) {
                    outcome = future.get();
                } else {
                    outcome = future.get(Math.max(deadlineNanos - System.nanoTime(), 0), TimeUnit.NANOSECONDS);
                }
                if (outcome == null) {
                    skipped.add(path);
                    continue;
                }
                analyses.add(outcome.analysis());
                details.add(outcome.detail());
            } catch (TimeoutException e) {
                timedOut = true;
                log.warn("Deadline of {} elapsed; cancelling unfinished files", request.deadline());
                future.cancel(true);
                skipped.add(path);
            } catch (CancellationException e) {
                skipped.add(path);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Skipping {}: {}", path, cause.getMessage(), cause);
                skipped.add(path);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnalysisException(AnalysisException.Stage.ANALYSIS, "Analysis interrupted", path, e);
            }
        }

        if (!skipped.isEmpty()) {
            log.warn("{} of {} files skipped", skipped.size(), files.size());
        }
        return new PerFileStage(analyses, details, skipped, !timedOut);
    }

    /**
     * Returns the outcome of a task that already finished, or cancels it.
     */
    private FileOutcome finishedOrCancel(Future<FileOutcome> future) throws ExecutionException, InterruptedException {
        if (future.isDone() && !future.isCancelled()) {
            return future.get();
        }
        future.cancel(true);
        return null;
    }

    private AiInsights enrich(AnalysisResult result) {
        if (!enrichmentEnabled) {
            return AiInsights.disabled();
        }
        if (enricher == null) {
            return AiInsights.unavailable("No insight enricher configured");
        }
        try {
            AiInsights insights = enricher.enrich(result);
            return insights != null ? insights : AiInsights.unavailable("Enricher returned no insights");
        } catch (RuntimeException e) {
            log.warn("Insight enrichment failed: {}", e.getMessage());
            return AiInsights.unavailable(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static Map<String, Integer> countLanguages(List<FileRecord> files) {
        Map<String, Integer> languages = new LinkedHashMap<>();
        for (FileRecord file : files) {
            languages.merge(file.language(), 1, Integer::sum);
        }
        return languages;
    }

    private record FileOutcome(FileAnalysis analysis, FileRiskDetail detail) {}

    private record PerFileStage(
        List<FileAnalysis> analyses,
        List<FileRiskDetail> details,
        List<String> skipped,
        boolean complete
    ) {}

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "release-gate-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
